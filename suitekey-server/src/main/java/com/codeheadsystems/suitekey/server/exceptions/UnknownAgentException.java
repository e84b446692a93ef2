package com.codeheadsystems.suitekey.server.exceptions;

/**
 * Thrown when an agent name is not present in the scope registry.
 */
public class UnknownAgentException extends IllegalArgumentException {

  private final String agentName;

  /**
   * Instantiates a new Unknown agent exception.
   *
   * @param agentName the agent name that was looked up
   */
  public UnknownAgentException(final String agentName) {
    super("Unknown agent: " + agentName);
    this.agentName = agentName;
  }

  /**
   * Agent name string.
   *
   * @return the string
   */
  public String agentName() {
    return agentName;
  }
}
