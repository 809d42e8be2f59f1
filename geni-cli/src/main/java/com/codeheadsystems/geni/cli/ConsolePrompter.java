package com.codeheadsystems.geni.cli;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Prompts on the system console, or on standard input and error when there is no console.
 */
public class ConsolePrompter implements Prompter {

  private final Console console;
  private final BufferedReader reader;
  private final PrintStream promptStream;

  /**
   * Instantiates a new Console prompter.
   */
  public ConsolePrompter() {
    this.console = System.console();
    this.reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    this.promptStream = System.err;
  }

  @Override
  public String readLine(final String prompt) {
    if (console != null) {
      return console.readLine("%s", prompt);
    }
    promptStream.print(prompt);
    promptStream.flush();
    try {
      return reader.readLine();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read input", e);
    }
  }

  @Override
  public String readPassword(final String prompt) {
    if (console == null) {
      return readLine(prompt);
    }
    char[] password = console.readPassword("%s", prompt);
    return password == null ? null : new String(password);
  }
}
