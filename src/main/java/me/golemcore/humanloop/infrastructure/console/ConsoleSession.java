package me.golemcore.humanloop.infrastructure.console;

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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * Terminal shared by the console loop and the console input adapter. One
 * prompt at a time: a prompt and the line read after it are never interleaved
 * with another prompt.
 */
public class ConsoleSession {

    private final BufferedReader reader;
    private final PrintStream out;

    public ConsoleSession(BufferedReader reader, PrintStream out) {
        this.reader = reader;
        this.out = out;
    }

    /**
     * Print {@code prompt} without a line break and read one line.
     *
     * @return the line, or null at end of input
     */
    public synchronized String prompt(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read console input", e);
        }
    }

    public synchronized void println(String line) {
        out.println(line);
        out.flush();
    }
}
