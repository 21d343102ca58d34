package me.golemcore.calhelper.infrastructure.console;

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
 * Line-oriented terminal access shared by the console front end and the
 * console confirmation port. Reads and writes are serialized.
 */
public class ConsoleIO {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleIO(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public synchronized void println(String text) {
        out.println(text);
        out.flush();
    }

    /**
     * Prints the prompt and reads one line.
     *
     * @return the line, or null at end of input
     */
    public synchronized String prompt(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read console input", e);
        }
    }
}
