package me.golemcore.worklog.adapter.inbound.cli;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.worklog.port.inbound.CommandPort;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Runs a single journal command taken from the process arguments. Command
 * output goes to standard output; warnings and errors go to standard error.
 * The exit code is 0 for success and 1 for a failed command.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandLineAdapter implements ApplicationRunner, ExitCodeGenerator {

    static final String DEFAULT_COMMAND = "help";

    private final CommandPort commandPort;

    private volatile int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(Arrays.asList(args.getSourceArgs()), System.out, System.err);
    }

    int execute(List<String> args, PrintStream out, PrintStream err) {
        String command = args.isEmpty() ? DEFAULT_COMMAND : args.get(0);
        List<String> rest = args.isEmpty() ? List.of() : args.subList(1, args.size());

        CommandPort.CommandResult result = commandPort.execute(command, rest).join();
        if (!result.success()) {
            err.println("error: " + result.output());
            return 1;
        }
        out.println(result.output());
        for (String warning : result.warnings()) {
            err.println("warning: " + warning);
        }
        log.debug("[CLI] {} completed with {} warning(s)", command, result.warnings().size());
        return 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
