/*
 * Copyright (c) 2023-2025 Umit Unal
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.umitunal.bitcask.protocol;

import com.umitunal.bitcask.api.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

/**
 * Maps the textual commands of the line protocol onto a {@link Storage}.
 *
 * <pre>
 * SET &lt;key&gt; &lt;value&gt;   -> OK
 * GET &lt;key&gt;           -> the value, or "Error: Key not found"
 * DELETE &lt;key&gt;        -> OK
 * </pre>
 *
 * <p>Tokens are separated by one or more spaces and the command name is case-insensitive.
 * Every failure is reported as a line starting with {@value #ERROR_PREFIX}; nothing is thrown.</p>
 */
public class CommandProcessor {
    private static final Logger logger = LoggerFactory.getLogger(CommandProcessor.class);

    public static final String OK = "OK";
    public static final String ERROR_PREFIX = "Error: ";

    static final String INVALID_COMMAND = ERROR_PREFIX + "Invalid command";
    static final String KEY_NOT_FOUND = ERROR_PREFIX + "Key not found";
    static final String SET_USAGE = ERROR_PREFIX + "SET command : SET <key> <value>";
    static final String GET_USAGE = ERROR_PREFIX + "GET command: GET <key>";
    static final String DELETE_USAGE = ERROR_PREFIX + "DELETE command : DELETE <key>";

    private final Storage storage;

    public CommandProcessor(Storage storage) {
        if (storage == null) throw new IllegalArgumentException("storage cannot be null");
        this.storage = storage;
    }

    /**
     * Executes one command line.
     *
     * @param line the command, without its line terminator
     * @return the response, without a line terminator
     */
    public String process(String line) {
        if (line == null) {
            return INVALID_COMMAND;
        }
        String[] parts = Arrays.stream(line.strip().split(" "))
                .filter(part -> !part.isEmpty())
                .toArray(String[]::new);
        if (parts.length == 0) {
            return INVALID_COMMAND;
        }

        String command = parts[0].toUpperCase(Locale.ROOT);
        String[] args = Arrays.copyOfRange(parts, 1, parts.length);
        try {
            switch (command) {
                case "SET":
                    return set(args);
                case "GET":
                    return get(args);
                case "DELETE":
                    return delete(args);
                default:
                    return INVALID_COMMAND;
            }
        } catch (RuntimeException e) {
            logger.warn("Command '{}' failed", command, e);
            return ERROR_PREFIX + e.getMessage();
        }
    }

    private String set(String[] args) {
        if (args.length != 2) {
            return SET_USAGE;
        }
        storage.put(args[0], args[1].getBytes(StandardCharsets.UTF_8));
        return OK;
    }

    private String get(String[] args) {
        if (args.length != 1) {
            return GET_USAGE;
        }
        byte[] value = storage.get(args[0]);
        if (value == null) {
            return KEY_NOT_FOUND;
        }
        return new String(value, StandardCharsets.UTF_8);
    }

    private String delete(String[] args) {
        if (args.length != 1) {
            return DELETE_USAGE;
        }
        storage.delete(args[0]);
        return OK;
    }
}
