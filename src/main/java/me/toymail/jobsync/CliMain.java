package me.toymail.jobsync;

import me.toymail.jobsync.commands.RootCmd;
import me.toymail.jobsync.logging.LoggingConfig;
import me.toymail.jobsync.service.ServiceContext;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;

public final class CliMain {
    public static void main(String[] args) {
        LoggingConfig.init();
        int code;
        try (ServiceContext context = ServiceContext.create().start()) {
            CommandLine.IFactory factory = new ServiceAwareFactory(context);
            code = new CommandLine(new RootCmd(context), factory).execute(args);
        } catch (IOException e) {
            LoggerFactory.getLogger(CliMain.class).error("Cannot open data home: {}", e.getMessage());
            code = 1;
        }
        System.exit(code);
    }
}
