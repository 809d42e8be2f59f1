package com.codeheadsystems.geni.cli;

import com.codeheadsystems.geni.client.accessor.CognitoIdentityProviderAccessor;
import com.codeheadsystems.geni.client.config.IdentityProviderConfig;
import com.codeheadsystems.geni.client.config.TokenStoreConfig;
import com.codeheadsystems.geni.client.exceptions.AuthenticationException;
import com.codeheadsystems.geni.client.manager.AuthSessionManager;
import com.codeheadsystems.geni.client.manager.BearerTokenProvider;
import com.codeheadsystems.geni.client.model.AuthOutcome;
import com.codeheadsystems.geni.client.model.AuthTokens;
import com.codeheadsystems.geni.client.model.IdTokenClaims;
import com.codeheadsystems.geni.client.store.TokenStore;
import com.codeheadsystems.geni.srp.SrpKeyExchange;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point for signing in to the Geni cloud service.
 *
 * <pre>
 * Usage:
 *   geni &lt;command&gt; [options]
 *
 * Commands:
 *   login      Authenticate with email and password and store the tokens.
 *   logout     Remove stored tokens.
 *   whoami     Show the logged-in user and when the session expires.
 *   token      Print the bearer token for API calls.
 *
 * Options:
 *   --email, -e &lt;email&gt;   Email address for login (prompted when absent)
 *   --no-keyring          Store tokens in ~/.geniable/tokens.json instead of the OS keyring
 * </pre>
 *
 * <p>Exit codes: 0 on success, 1 on usage or other errors, 2 when authentication fails or
 * no one is logged in. Set {@code GENI_LOG_LEVEL=DEBUG} for diagnostics on standard error.
 */
public class GeniCli {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_AUTHENTICATION = 2;
  static final int MIN_PASSWORD_LENGTH = 12;

  private static final Logger log = LoggerFactory.getLogger(GeniCli.class);
  private static final DateTimeFormatter EXPIRY_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

  private final Function<TokenStoreConfig, AuthSessionManager> managerFactory;
  private final TokenStoreConfig tokenStoreConfig;
  private final Prompter prompter;
  private final PrintStream out;
  private final PrintStream err;
  private final Clock clock;

  /**
   * Instantiates a new Geni cli.
   *
   * @param managerFactory   builds the session manager once the storage options are known
   * @param tokenStoreConfig the default token storage
   * @param prompter         the prompter
   * @param out              the output stream
   * @param err              the error stream
   * @param clock            the clock
   */
  public GeniCli(final Function<TokenStoreConfig, AuthSessionManager> managerFactory,
                 final TokenStoreConfig tokenStoreConfig,
                 final Prompter prompter,
                 final PrintStream out,
                 final PrintStream err,
                 final Clock clock) {
    this.managerFactory = managerFactory;
    this.tokenStoreConfig = tokenStoreConfig;
    this.prompter = prompter;
    this.out = out;
    this.err = err;
    this.clock = clock;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    GeniCli cli = new GeniCli(GeniCli::createManager, TokenStoreConfig.defaults(),
        new ConsolePrompter(), System.out, System.err, Clock.systemUTC());
    System.exit(cli.run(args));
  }

  /**
   * Wires the production session manager.
   *
   * @param tokenStoreConfig the token storage
   * @return the auth session manager
   */
  static AuthSessionManager createManager(TokenStoreConfig tokenStoreConfig) {
    IdentityProviderConfig config = IdentityProviderConfig.fromEnvironment();
    ObjectMapper objectMapper = new ObjectMapper();
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(config.requestTimeout())
        .build();
    CognitoIdentityProviderAccessor accessor =
        new CognitoIdentityProviderAccessor(httpClient, objectMapper, config);
    TokenStore tokenStore = new TokenStore(tokenStoreConfig, objectMapper);
    return new AuthSessionManager(config, accessor, tokenStore, new SrpKeyExchange(), Clock.systemUTC());
  }

  /**
   * Runs one command.
   *
   * @param args command-line arguments
   * @return the exit code
   */
  public int run(String[] args) {
    String email = null;
    boolean useKeyring = tokenStoreConfig.useKeyring();
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--email", "-e" -> {
          if (i + 1 >= args.length) {
            err.println("Missing value for " + args[i]);
            return EXIT_FAILURE;
          }
          email = args[++i];
        }
        case "--no-keyring" -> useKeyring = false;
        case "--help", "-h" -> {
          printUsage(out);
          return EXIT_OK;
        }
        default -> positional.add(args[i]);
      }
    }

    if (positional.size() != 1) {
      printUsage(err);
      return EXIT_FAILURE;
    }
    String command = positional.get(0);
    log.debug("run(command={}, keyring={})", command, useKeyring);

    try {
      return switch (command) {
        case "login" -> runLogin(manager(useKeyring), email);
        case "logout" -> runLogout(manager(useKeyring));
        case "whoami" -> runWhoami(manager(useKeyring));
        case "token" -> runToken(manager(useKeyring));
        default -> {
          err.println("Unknown command: " + command);
          printUsage(err);
          yield EXIT_FAILURE;
        }
      };
    } catch (AuthenticationException e) {
      err.println("Authentication failed: " + e.getMessage());
      return EXIT_AUTHENTICATION;
    } catch (RuntimeException e) {
      log.debug("Command {} failed", command, e);
      err.println("Error: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private AuthSessionManager manager(boolean useKeyring) {
    return managerFactory.apply(tokenStoreConfig.withKeyring(useKeyring));
  }

  // ── Commands ──────────────────────────────────────────────────────────────

  private int runLogin(AuthSessionManager manager, String emailOption) {
    String email = emailOption;
    if (email == null || email.isBlank()) {
      email = prompter.readLine("Email: ");
    }
    if (email == null || email.isBlank()) {
      err.println("Email is required");
      return EXIT_FAILURE;
    }
    String loginEmail = email.trim();
    String password = prompter.readPassword("Password: ");
    if (password == null || password.isEmpty()) {
      err.println("Password is required");
      return EXIT_FAILURE;
    }

    out.println("Authenticating...");
    AuthOutcome outcome = manager.login(loginEmail, password);
    return outcome.map(
        authenticated -> printLoggedIn(authenticated.tokens()),
        change -> changePassword(manager, change, loginEmail));
  }

  private int changePassword(AuthSessionManager manager,
                             AuthOutcome.PasswordChangeRequired change,
                             String email) {
    out.println("Password change required for new account.");
    out.println("Please set a new permanent password.");
    out.println("Requirements: min " + MIN_PASSWORD_LENGTH + " chars, uppercase, lowercase, numbers");

    String newPassword = readNewPassword();
    if (newPassword == null) {
      err.println("Password change cancelled");
      return EXIT_FAILURE;
    }
    out.println("Setting new password...");
    try {
      AuthTokens tokens = manager.completePasswordChange(change.session(), change.userId(), newPassword, email);
      out.println("Password changed successfully!");
      return printLoggedIn(tokens);
    } catch (AuthenticationException e) {
      err.println("Password change failed: " + e.getMessage());
      return EXIT_AUTHENTICATION;
    }
  }

  private String readNewPassword() {
    while (true) {
      String newPassword = prompter.readPassword("New password: ");
      if (newPassword == null) {
        return null;
      }
      if (newPassword.isEmpty()) {
        err.println("Password is required");
        continue;
      }
      if (newPassword.length() < MIN_PASSWORD_LENGTH) {
        err.println("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        continue;
      }
      String confirm = prompter.readPassword("Confirm new password: ");
      if (confirm == null) {
        return null;
      }
      if (!newPassword.equals(confirm)) {
        err.println("Passwords do not match");
        continue;
      }
      return newPassword;
    }
  }

  private int printLoggedIn(AuthTokens tokens) {
    out.println("Successfully logged in as " + tokens.email());
    out.println("Session expires: " + EXPIRY_FORMAT.format(tokens.expiresAt()));
    return EXIT_OK;
  }

  private int runLogout(AuthSessionManager manager) {
    if (!manager.isAuthenticated()) {
      out.println("Not currently logged in");
      return EXIT_OK;
    }
    manager.logout();
    out.println("Successfully logged out");
    return EXIT_OK;
  }

  private int runWhoami(AuthSessionManager manager) {
    Optional<AuthTokens> current = manager.getCurrentTokens();
    if (current.isEmpty()) {
      err.println("Not logged in");
      err.println("Run 'geni login' to authenticate");
      return EXIT_AUTHENTICATION;
    }
    AuthTokens tokens = current.get();
    IdTokenClaims claims = IdTokenClaims.decode(tokens.idToken());

    out.println("Authentication Status");
    out.println("  Email   : " + valueOrUnknown(claims.email().isEmpty() ? tokens.email() : claims.email()));
    out.println("  User ID : " + valueOrUnknown(claims.subject().isEmpty() ? tokens.userId() : claims.subject()));
    Duration remaining = Duration.between(clock.instant(), tokens.expiresAt());
    if (remaining.isNegative() || remaining.isZero()) {
      out.println("Session expired - run 'geni login' to reauthenticate");
    } else {
      out.println("  Session expires in: " + remaining.toHours() + "h " + remaining.toMinutesPart() + "m");
      out.println("  (" + EXPIRY_FORMAT.format(tokens.expiresAt()) + ")");
    }
    out.println("Authenticated and ready");
    return EXIT_OK;
  }

  private int runToken(AuthSessionManager manager) {
    out.println(new BearerTokenProvider(manager).requireBearerToken());
    return EXIT_OK;
  }

  private static String valueOrUnknown(String value) {
    return (value == null || value.isEmpty()) ? "Unknown" : value;
  }

  private static void printUsage(PrintStream stream) {
    stream.println("Usage: geni <command> [options]");
    stream.println();
    stream.println("Commands:");
    stream.println("  login      Authenticate with email and password");
    stream.println("  logout     Remove stored tokens");
    stream.println("  whoami     Show the logged-in user and session expiry");
    stream.println("  token      Print the bearer token for API calls");
    stream.println();
    stream.println("Options:");
    stream.println("  --email, -e <email>   Email address for login");
    stream.println("  --no-keyring          Store tokens in a file instead of the OS keyring");
  }
}
