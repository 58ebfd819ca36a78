package com.vidnyan.attackpath.adapter.in.cli;

import com.vidnyan.attackpath.AnalysisProperties;
import com.vidnyan.attackpath.application.port.in.AnalyzeGraphUseCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * CLI Runner for standalone graph analysis.
 * Dispatches the program arguments to the picocli command tree and keeps the
 * resulting exit code for {@code SpringApplication.exit}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AnalyzeGraphUseCase analyzeGraphUseCase;
    private final AnalysisProperties properties;

    private int exitCode = ExitCodes.OK;

    @Override
    public void run(String... args) {
        if (args.length == 0) {
            log.info("No command specified. Usage: analyze --graph <path> --target <nodeId> --out <dir>");
            return;
        }
        exitCode = commandLine().execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    CommandLine commandLine() {
        return new CommandLine(new RootCommand())
                .addSubcommand("analyze", new AnalyzeCommand(analyzeGraphUseCase, properties));
    }

    @CommandLine.Command(
        name = "attack-path",
        description = "Attack path discovery and scoring over rule interaction graphs.",
        mixinStandardHelpOptions = true
    )
    static final class RootCommand implements Runnable {

        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @Override
        public void run() {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing command, expected 'analyze'");
        }
    }
}
