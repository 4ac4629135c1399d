package com.warden.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.List;
import java.util.Set;

/**
 * Runs one picocli command against the started context and keeps its exit code for
 * {@link com.warden.WardenApplication}. A {@code serve} invocation is left to the embedded server.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private static final Set<String> INFO_OPTIONS = Set.of("-h", "--help", "-V", "--version");

    private final WardenCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(WardenCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    /**
     * True when {@code serve} is the subcommand and no help or version option asks picocli to answer
     * instead. Leading options before the subcommand are skipped.
     */
    public static boolean isServe(String... args) {
        List<String> list = List.of(args);
        int index = 0;
        while (index < list.size() && list.get(index).startsWith("-")) {
            index++;
        }
        if (index == list.size() || !"serve".equals(list.get(index))) {
            return false;
        }
        return list.subList(index + 1, list.size()).stream().noneMatch(INFO_OPTIONS::contains);
    }

    @Override
    public void run(String... args) {
        if (isServe(args)) {
            log.debug("Serve mode; the web server keeps the process alive");
            return;
        }
        exitCode = new CommandLine(rootCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
