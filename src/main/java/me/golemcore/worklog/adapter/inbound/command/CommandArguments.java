package me.golemcore.worklog.adapter.inbound.command;

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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsed command arguments: positional words, boolean flags and valued
 * options. Valued options may repeat ({@code --tag a --tag b}) and also
 * accept the {@code --name=value} form.
 */
final class CommandArguments {

    private static final String OPTION_PREFIX = "--";

    private final List<String> positional;
    private final Set<String> flags;
    private final Map<String, List<String>> options;

    private CommandArguments(List<String> positional, Set<String> flags, Map<String, List<String>> options) {
        this.positional = positional;
        this.flags = flags;
        this.options = options;
    }

    /**
     * @throws IllegalArgumentException
     *             for an unknown option or a valued option without value
     */
    static CommandArguments parse(List<String> args, Set<String> allowedFlags, Set<String> allowedOptions) {
        List<String> positional = new ArrayList<>();
        Set<String> flags = new HashSet<>();
        Map<String, List<String>> options = new LinkedHashMap<>();

        List<String> input = args != null ? args : List.of();
        for (int i = 0; i < input.size(); i++) {
            String arg = input.get(i);
            if (!arg.startsWith(OPTION_PREFIX) || arg.length() == OPTION_PREFIX.length()) {
                positional.add(arg);
                continue;
            }

            String name = arg.substring(OPTION_PREFIX.length());
            String inlineValue = null;
            int equals = name.indexOf('=');
            if (equals >= 0) {
                inlineValue = name.substring(equals + 1);
                name = name.substring(0, equals);
            }

            if (allowedFlags.contains(name) && inlineValue == null) {
                flags.add(name);
            } else if (allowedOptions.contains(name)) {
                String value = inlineValue;
                if (value == null) {
                    if (i + 1 >= input.size()) {
                        throw new IllegalArgumentException("Option --" + name + " requires a value");
                    }
                    value = input.get(++i);
                }
                options.computeIfAbsent(name, key -> new ArrayList<>()).add(value);
            } else {
                throw new IllegalArgumentException("Unknown option: --" + name);
            }
        }
        return new CommandArguments(positional, flags, options);
    }

    List<String> positional() {
        return positional;
    }

    String positionalText() {
        return positional.isEmpty() ? null : String.join(" ", positional);
    }

    boolean flag(String name) {
        return flags.contains(name);
    }

    String value(String name) {
        List<String> values = options.get(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    List<String> values(String name) {
        return options.getOrDefault(name, List.of());
    }

    Integer intValue(String name) {
        String value = value(name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option --" + name + " expects a number, got '" + value + "'", e);
        }
    }
}
