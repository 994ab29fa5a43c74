package me.toymail.jobsync;

import jakarta.mail.*;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.search.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * One IMAP session for one mailbox account.
 */
public final class ImapClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ImapClient.class);

    public record ImapConfig(String host, int port, boolean useTLS, boolean rejectUnauthorized,
                             String username, String password,
                             int connectionTimeoutMs, int readTimeoutMs, int writeTimeoutMs,
                             int fetchBatchSize) {}

    /**
     * A message as read from the server. Either body may be null.
     */
    public record RawMessage(String messageId, String folder, long uid, String from, String subject,
                             Instant receivedAt, String textBody, String htmlBody) {}

    /**
     * A folder that was skipped during a search.
     */
    public record FolderFetchError(String folder, String error) {}

    /**
     * Progress callbacks for {@link #search}. Runtime exceptions thrown from a callback abort the stream.
     */
    public interface SearchListener {
        default void folderStarted(String folder, int index, int total) {}

        default void folderCompleted(String folder, int matched) {}

        default void folderFailed(FolderFetchError error) {}

        default void messageSkipped(String folder, String reason) {}
    }

    // Server-side prefilter. IMAP FROM/SUBJECT terms match case-insensitive substrings.
    static final List<String> RECRUITING_SENDERS = List.of(
            "jobs-noreply@linkedin.com", "careers@", "talent@", "recruiting@", "hr@",
            "no-reply@hire.lever.co", "notification@", "@greenhouse.io", "do_not_reply@clearcompany.com",
            "donotreply@", "no-reply@", "noreply@", "applications@", "recruitment@", "talent-acquisition@");

    static final List<String> JOB_SUBJECT_WORDS = List.of(
            "application", "applied", "job", "position", "career", "thank you", "received",
            "viewed", "interview", "status", "update");

    private final Store store;
    private final int fetchBatchSize;

    ImapClient(Store store, int fetchBatchSize) {
        this.store = store;
        this.fetchBatchSize = Math.max(1, fetchBatchSize);
    }

    public static ImapClient connect(ImapConfig cfg) throws MailboxConnectionException {
        String protocol = cfg.useTLS() ? "imaps" : "imap";
        Properties props = new Properties();
        props.put("mail.store.protocol", protocol);
        props.put("mail." + protocol + ".connectiontimeout", String.valueOf(cfg.connectionTimeoutMs()));
        props.put("mail." + protocol + ".timeout", String.valueOf(cfg.readTimeoutMs()));
        props.put("mail." + protocol + ".writetimeout", String.valueOf(cfg.writeTimeoutMs()));
        if (cfg.useTLS()) {
            props.put("mail.imaps.ssl.enable", "true");
            props.put("mail.imaps.ssl.checkserveridentity", String.valueOf(cfg.rejectUnauthorized()));
            if (!cfg.rejectUnauthorized()) {
                props.put("mail.imaps.ssl.trust", "*");
            }
        }

        Session session = Session.getInstance(props);
        try {
            Store store = session.getStore(protocol);
            store.connect(cfg.host(), cfg.port(), cfg.username(), cfg.password());
            log.info("Connected to {}:{} as {}", cfg.host(), cfg.port(), cfg.username());
            return new ImapClient(store, cfg.fetchBatchSize());
        } catch (AuthenticationFailedException e) {
            throw new MailboxConnectionException("Authentication failed for " + cfg.username(), e);
        } catch (MessagingException e) {
            throw new MailboxConnectionException(
                    "Cannot connect to " + cfg.host() + ":" + cfg.port() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            if (store.isConnected()) store.close();
        } catch (MessagingException e) {
            log.warn("Error closing IMAP session: {}", e.getMessage());
        }
    }

    /**
     * Full names of every folder in the account.
     */
    public List<String> listFolders() throws MailboxConnectionException {
        try {
            Folder root = store.getDefaultFolder();
            Folder[] all = root.list("*");
            List<String> out = new ArrayList<>(all.length);
            for (Folder f : all) out.add(f.getFullName());
            return out;
        } catch (MessagingException e) {
            throw new MailboxConnectionException("Cannot list folders: " + e.getMessage(), e);
        }
    }

    /**
     * Messages received on or after {@code since} in the given folders, in folder order and then
     * mailbox order. The stream is lazy and single-use; close it to release the open folder.
     */
    public Stream<RawMessage> search(Date since, List<String> folders, SearchListener listener) {
        FolderWalk walk = new FolderWalk(since, folders, listener != null ? listener : new SearchListener() {});
        return StreamSupport.stream(walk, false).onClose(walk::closeCurrent);
    }

    static SearchTerm searchTerm(Date since) {
        SearchTerm[] senders = RECRUITING_SENDERS.stream().map(FromStringTerm::new).toArray(SearchTerm[]::new);
        SearchTerm[] subjects = JOB_SUBJECT_WORDS.stream().map(SubjectTerm::new).toArray(SearchTerm[]::new);
        return new AndTerm(
                new ReceivedDateTerm(ComparisonTerm.GE, since),
                new OrTerm(new OrTerm(senders), new OrTerm(subjects)));
    }

    private final class FolderWalk extends Spliterators.AbstractSpliterator<RawMessage> {
        private final Date since;
        private final List<String> folders;
        private final SearchListener listener;
        private int folderIndex = -1;
        private Folder current;
        private String currentName;
        private Message[] matched = new Message[0];
        private int position;

        FolderWalk(Date since, List<String> folders, SearchListener listener) {
            super(Long.MAX_VALUE, ORDERED | NONNULL);
            this.since = since;
            this.folders = folders;
            this.listener = listener;
        }

        @Override
        public boolean tryAdvance(Consumer<? super RawMessage> action) {
            while (true) {
                while (position < matched.length) {
                    if (position % fetchBatchSize == 0) prefetch(position);
                    Message m = matched[position++];
                    Optional<RawMessage> raw = read(m);
                    if (raw.isPresent()) {
                        action.accept(raw.get());
                        return true;
                    }
                }
                if (current != null) {
                    listener.folderCompleted(currentName, matched.length);
                    closeCurrent();
                }
                if (!openNext()) return false;
            }
        }

        private boolean openNext() {
            while (++folderIndex < folders.size()) {
                String name = folders.get(folderIndex);
                listener.folderStarted(name, folderIndex, folders.size());
                try {
                    Folder f = store.getFolder(name);
                    if (!f.exists()) {
                        listener.folderFailed(new FolderFetchError(name, "Folder does not exist"));
                        continue;
                    }
                    f.open(Folder.READ_ONLY);
                    current = f;
                    currentName = name;
                    Message[] found = f.search(searchTerm(since));
                    matched = found != null ? found : new Message[0];
                    Arrays.sort(matched, Comparator.comparingInt(Message::getMessageNumber));
                    position = 0;
                    log.debug("Folder {}: {} candidate messages since {}", name, matched.length, since);
                    return true;
                } catch (MessagingException e) {
                    log.warn("Skipping folder {}: {}", name, e.getMessage());
                    listener.folderFailed(new FolderFetchError(name, e.getMessage()));
                    closeCurrent();
                }
            }
            return false;
        }

        private void prefetch(int from) {
            Message[] slice = Arrays.copyOfRange(matched, from, Math.min(matched.length, from + fetchBatchSize));
            FetchProfile fp = new FetchProfile();
            fp.add(FetchProfile.Item.ENVELOPE);
            fp.add(FetchProfile.Item.CONTENT_INFO);
            try {
                current.fetch(slice, fp);
            } catch (MessagingException e) {
                // messages are still readable one by one
                log.debug("Batch fetch failed in {}: {}", currentName, e.getMessage());
            }
        }

        private Optional<RawMessage> read(Message m) {
            try {
                return Optional.of(toRaw(current, currentName, m));
            } catch (MessagingException | IOException e) {
                log.debug("Skipping unreadable message {} in {}: {}", m.getMessageNumber(), currentName, e.getMessage());
                listener.messageSkipped(currentName, e.getMessage());
                return Optional.empty();
            }
        }

        void closeCurrent() {
            if (current == null) return;
            try {
                if (current.isOpen()) current.close(false);
            } catch (MessagingException e) {
                log.debug("Error closing folder {}: {}", currentName, e.getMessage());
            }
            current = null;
            matched = new Message[0];
            position = 0;
        }
    }

    private static RawMessage toRaw(Folder folder, String folderName, Message m) throws MessagingException, IOException {
        long uid = folder instanceof UIDFolder uf ? uf.getUID(m) : -1L;
        String from = null;
        Address[] froms = m.getFrom();
        if (froms != null && froms.length > 0) from = froms[0].toString();
        Date when = m.getReceivedDate() != null ? m.getReceivedDate() : m.getSentDate();

        String messageId = m instanceof MimeMessage mm ? mm.getMessageID() : null;
        if (messageId == null) messageId = folderName + ":" + (uid >= 0 ? uid : m.getMessageNumber());

        Bodies bodies = new Bodies();
        collectBodies(m, bodies);
        return new RawMessage(messageId, folderName, uid, from, m.getSubject(),
                when != null ? when.toInstant() : null, bodies.text, bodies.html);
    }

    private static final class Bodies {
        String text;
        String html;
    }

    private static void collectBodies(Part p, Bodies out) throws MessagingException, IOException {
        if (Part.ATTACHMENT.equalsIgnoreCase(p.getDisposition())) return;
        if (p.isMimeType("text/plain")) {
            if (out.text == null) out.text = String.valueOf(p.getContent());
        } else if (p.isMimeType("text/html")) {
            if (out.html == null) out.html = String.valueOf(p.getContent());
        } else if (p.isMimeType("multipart/*")) {
            Multipart mp = (Multipart) p.getContent();
            for (int i = 0; i < mp.getCount(); i++) {
                collectBodies(mp.getBodyPart(i), out);
            }
        }
    }
}
