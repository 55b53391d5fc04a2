package examples;

import com.cajunsystems.synccell.HandoffMode;
import com.cajunsystems.synccell.ReaderWakeup;
import com.cajunsystems.synccell.SyncCell;
import com.cajunsystems.synccell.SyncCellConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Guards a session token with a {@link SyncCell}.
 *
 * <p>Requests read the token. When a request finds it expired, it takes the token out of the
 * cell so that other requests wait, logs in again and puts the fresh token back.
 */
public class TokenRefreshExample {

    private static final Logger logger = LoggerFactory.getLogger(TokenRefreshExample.class);

    public enum Status { OK, UNAUTHORIZED }

    public record Response(int requestId, Status status, String token) {
    }

    private final Set<String> issuedTokens = ConcurrentHashMap.newKeySet();
    private final AtomicInteger logins = new AtomicInteger();
    private final AtomicInteger requestIds = new AtomicInteger();
    // Overlapping logouts hand the fresh token straight to the next one, and every
    // request parked on an empty cell must see the fresh token.
    private final SyncCell<String> tokenCell = SyncCell.newEmpty(new SyncCellConfig()
            .setName("session-token")
            .setHandoffMode(HandoffMode.BYPASS_SLOT)
            .setReaderWakeup(ReaderWakeup.ALL));

    /**
     * Issues a new token.
     *
     * @return The new token
     */
    public String loginRequest() {
        String token = "token-" + ThreadLocalRandom.current().nextInt(1, 10_000) + "-" + logins.incrementAndGet();
        issuedTokens.add(token);
        logger.info("New token \"{}\" issued", token);
        return token;
    }

    /**
     * Logs in and stores the token in the cell. Blocks if a token is already stored.
     */
    public void login() {
        tokenCell.put(loginRequest()).get();
    }

    /**
     * Invalidates every issued token.
     */
    public void wipeTokens() {
        issuedTokens.clear();
        logger.info("Tokens wiped");
    }

    public boolean isTokenValid(String token) {
        return issuedTokens.contains(token);
    }

    /**
     * Replaces the stored token. Other requests wait until the new one is in place.
     */
    public void handleLogout() {
        tokenCell.take().get();
        tokenCell.put(loginRequest()).get();
    }

    /**
     * Runs a request with the current token, logging in again and retrying while the
     * token turns out to be expired.
     *
     * @param request The request, given the token and returning a status
     * @return The successful response
     */
    public Response runRequest(Function<String, Status> request) {
        int id = requestIds.incrementAndGet();
        while (true) {
            String token = tokenCell.read().get();
            logger.info("[{}] Request with token {}", id, token);
            Status status = request.apply(token);
            logger.info("[{}] {}", id, status);
            if (status == Status.OK) {
                return new Response(id, status, token);
            }
            logger.info("[{}] Session expired", id);
            handleLogout();
        }
    }

    /**
     * A request that succeeds only with a currently valid token.
     */
    public Status someRequest(String token) {
        return isTokenValid(token) ? Status.OK : Status.UNAUTHORIZED;
    }

    public int loginCount() {
        return logins.get();
    }

    public SyncCell<String> tokenCell() {
        return tokenCell;
    }

    public static void main(String[] args) throws Exception {
        TokenRefreshExample example = new TokenRefreshExample();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            example.login();
            example.runRequest(example::someRequest);

            example.wipeTokens();
            List<Future<Response>> responses = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                responses.add(executor.submit(() -> example.runRequest(example::someRequest)));
            }
            for (Future<Response> response : responses) {
                Response done = response.get(5, TimeUnit.SECONDS);
                logger.info("[{}] finished with {}", done.requestId(), done.status());
            }
            logger.info("Logged in {} times", example.loginCount());
        } finally {
            executor.shutdown();
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        }
    }
}
