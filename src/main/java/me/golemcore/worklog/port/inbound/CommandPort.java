package me.golemcore.worklog.port.inbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for executing journal commands (snapshot, journal, recall, week,
 * hooks, help). Inbound adapters translate their input into a command name
 * and arguments and print the returned output.
 */
public interface CommandPort {

    /**
     * Executes a command with the given arguments.
     *
     * @param command
     *            Command name
     * @param args
     *            Remaining arguments, options included
     * @return Command execution result with success status and output
     */
    CompletableFuture<CommandResult> execute(String command, List<String> args);

    /**
     * Checks if a command with the given name is registered.
     */
    boolean hasCommand(String command);

    /**
     * Returns a list of all available commands with their definitions.
     */
    List<CommandDefinition> listCommands();

    /**
     * Represents the result of a command execution including success status,
     * output and non-fatal warnings.
     */
    record CommandResult(
            boolean success,
            String output,
            List<String> warnings) {

        /**
         * Creates a successful command result.
         */
        public static CommandResult success(String output) {
            return new CommandResult(true, output, List.of());
        }

        public static CommandResult success(String output, List<String> warnings) {
            return new CommandResult(true, output, List.copyOf(warnings));
        }

        /**
         * Creates a failed command result with error message.
         */
        public static CommandResult failure(String error) {
            return new CommandResult(false, error, List.of());
        }
    }

    /**
     * Defines a command's metadata including name, description, and usage.
     */
    record CommandDefinition(
            String name,
            String description,
            String usage) {
    }
}
