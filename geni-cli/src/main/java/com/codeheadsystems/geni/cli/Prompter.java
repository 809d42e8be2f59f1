package com.codeheadsystems.geni.cli;

/**
 * Reads answers from the user.
 */
public interface Prompter {

  /**
   * Shows the prompt and reads a line.
   *
   * @param prompt the prompt
   * @return the line, or null at end of input
   */
  String readLine(String prompt);

  /**
   * Shows the prompt and reads a line without echoing it where the terminal allows.
   *
   * @param prompt the prompt
   * @return the line, or null at end of input
   */
  String readPassword(String prompt);
}
