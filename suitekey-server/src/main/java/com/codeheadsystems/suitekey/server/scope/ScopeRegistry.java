package com.codeheadsystems.suitekey.server.scope;

import com.codeheadsystems.suitekey.server.exceptions.UnknownAgentException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declarative table from agent name to the OAuth scopes that agent needs.
 * <p>
 * Immutable once built, so it can be shared freely between request threads. Agent names are
 * matched case-insensitively.
 */
public class ScopeRegistry {

  private static final Logger log = LoggerFactory.getLogger(ScopeRegistry.class);

  private static final String GOOGLE_AUTH = "https://www.googleapis.com/auth/";

  /**
   * The agents shipped with the suite and the scopes their Workspace calls require.
   */
  public static final Map<String, Set<String>> GOOGLE_WORKSPACE_DEFAULTS = defaultTable();

  private final Map<String, Set<AuthorizationScope>> scopesByAgent;

  /**
   * Instantiates a new Scope registry.
   *
   * @param table agent name to raw scope strings
   */
  public ScopeRegistry(final Map<String, ? extends Collection<String>> table) {
    Map<String, Set<AuthorizationScope>> copy = new LinkedHashMap<>();
    table.forEach((agent, scopes) -> {
      if (scopes == null || scopes.isEmpty()) {
        throw new IllegalArgumentException("Agent '" + agent + "' has no scopes");
      }
      Set<AuthorizationScope> parsed = scopes.stream()
          .map(AuthorizationScope::new)
          .collect(Collectors.toUnmodifiableSet());
      if (copy.put(normalize(agent), parsed) != null) {
        throw new IllegalArgumentException("Agent '" + agent + "' registered twice");
      }
    });
    this.scopesByAgent = Map.copyOf(copy);
    log.info("ScopeRegistry(agents={})", scopesByAgent.keySet());
  }

  /**
   * Registry containing only the built-in Workspace agents.
   *
   * @return the scope registry
   */
  public static ScopeRegistry googleWorkspace() {
    return new ScopeRegistry(GOOGLE_WORKSPACE_DEFAULTS);
  }

  /**
   * Built-in agents, with entries from {@code overrides} replacing or adding to them.
   *
   * @param overrides agent name to raw scope strings
   * @return the scope registry
   */
  public static ScopeRegistry googleWorkspaceWith(final Map<String, ? extends Collection<String>> overrides) {
    Map<String, Collection<String>> merged = new LinkedHashMap<>();
    GOOGLE_WORKSPACE_DEFAULTS.forEach((k, v) -> merged.put(normalize(k), v));
    overrides.forEach((k, v) -> merged.put(normalize(k), v));
    return new ScopeRegistry(merged);
  }

  /**
   * Scopes required by one agent.
   *
   * @param agentName the agent name
   * @return the set
   * @throws UnknownAgentException if the agent is not registered
   */
  public Set<AuthorizationScope> scopesFor(final String agentName) {
    if (agentName == null) {
      throw new UnknownAgentException(null);
    }
    Set<AuthorizationScope> scopes = scopesByAgent.get(normalize(agentName));
    if (scopes == null) {
      throw new UnknownAgentException(agentName);
    }
    return scopes;
  }

  /**
   * Union of the scopes of several agents, for a single combined consent request.
   *
   * @param agentNames the agent names
   * @return the set
   * @throws UnknownAgentException if any agent is not registered
   */
  public Set<AuthorizationScope> mergedScopes(final String... agentNames) {
    return mergedScopes(Arrays.asList(agentNames));
  }

  /**
   * Merged scopes set.
   *
   * @param agentNames the agent names
   * @return the set
   */
  public Set<AuthorizationScope> mergedScopes(final Collection<String> agentNames) {
    Set<AuthorizationScope> merged = new HashSet<>();
    for (String agentName : agentNames) {
      merged.addAll(scopesFor(agentName));
    }
    return Set.copyOf(merged);
  }

  /**
   * Registered agent names.
   *
   * @return the set
   */
  public Set<String> agentNames() {
    return scopesByAgent.keySet();
  }

  private static String normalize(String agentName) {
    return agentName.trim().toLowerCase(Locale.ROOT);
  }

  private static Map<String, Set<String>> defaultTable() {
    Map<String, Set<String>> table = new LinkedHashMap<>();
    table.put("sheets", Set.of(GOOGLE_AUTH + "spreadsheets"));
    table.put("docs", Set.of(GOOGLE_AUTH + "documents"));
    table.put("drive", Set.of(GOOGLE_AUTH + "drive"));
    table.put("slides", Set.of(GOOGLE_AUTH + "presentations"));
    table.put("chat", Set.of(GOOGLE_AUTH + "chat.messages"));
    table.put("calendar", Set.of(GOOGLE_AUTH + "calendar"));
    return Collections.unmodifiableMap(table);
  }
}
