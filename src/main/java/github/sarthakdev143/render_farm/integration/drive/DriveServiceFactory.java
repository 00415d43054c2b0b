package github.sarthakdev143.render_farm.integration.drive;

import com.google.api.client.auth.oauth2.AuthorizationCodeResponseUrl;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeFlow;
import com.google.api.client.googleapis.auth.oauth2.GoogleClientSecrets;
import com.google.api.client.googleapis.auth.oauth2.GoogleTokenResponse;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.client.util.store.FileDataStoreFactory;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.DriveScopes;
import com.sun.net.httpserver.HttpServer;
import github.sarthakdev143.render_farm.config.RenderFarmProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds an authorized Drive client. The first run completes an installed-app OAuth flow
 * through a local callback server; later runs reuse the stored refresh token.
 */
public class DriveServiceFactory {

    private static final Logger logger = LoggerFactory.getLogger(DriveServiceFactory.class);

    static final String CREDENTIALS_PATH_ENV = "DRIVE_CREDENTIALS_PATH";
    private static final int OAUTH_CALLBACK_PORT = 8889;
    private static final String OAUTH_CALLBACK_PATH = "/oauth2callback";
    private static final String OAUTH_CALLBACK_URI = "http://localhost:" + OAUTH_CALLBACK_PORT + OAUTH_CALLBACK_PATH;
    private static final String OAUTH_USER_ID = "render-farm";
    private static final long AUTHORIZATION_TIMEOUT_MINUTES = 3;
    private static final List<String> SCOPES = List.of(DriveScopes.DRIVE_FILE);

    private final RenderFarmProperties.Upload uploadProperties;

    public DriveServiceFactory(RenderFarmProperties.Upload uploadProperties) {
        this.uploadProperties = uploadProperties;
    }

    public Drive createService() throws GeneralSecurityException, IOException {
        Path credentialsPath = requireCredentials(uploadProperties);
        HttpTransport httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        JsonFactory jsonFactory = GsonFactory.getDefaultInstance();
        Credential credential = authorize(credentialsPath, httpTransport, jsonFactory);

        return new Drive.Builder(httpTransport, jsonFactory, credential)
                .setApplicationName(uploadProperties.getApplicationName())
                .build();
    }

    /**
     * {@code DRIVE_CREDENTIALS_PATH} when set, otherwise the configured path.
     */
    public static Path resolveCredentialsPath(RenderFarmProperties.Upload uploadProperties) {
        String configuredPath = System.getenv(CREDENTIALS_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            return Path.of(configuredPath);
        }
        return Path.of(uploadProperties.getCredentialsPath());
    }

    private Path requireCredentials(RenderFarmProperties.Upload properties) throws FileNotFoundException {
        Path credentialsPath = resolveCredentialsPath(properties);
        if (!Files.isRegularFile(credentialsPath)) {
            throw new FileNotFoundException(
                    "Drive credentials file not found at " + credentialsPath.toAbsolutePath()
                            + ". Set " + CREDENTIALS_PATH_ENV + " or render-farm.upload.credentials-path.");
        }
        return credentialsPath;
    }

    private Credential authorize(Path credentialsPath, HttpTransport httpTransport, JsonFactory jsonFactory)
            throws IOException {
        GoogleClientSecrets clientSecrets;
        try (InputStream credentialsStream = Files.newInputStream(credentialsPath);
             InputStreamReader reader = new InputStreamReader(credentialsStream, StandardCharsets.UTF_8)) {
            clientSecrets = GoogleClientSecrets.load(jsonFactory, reader);
        }

        if (clientSecrets.getDetails() == null
                || clientSecrets.getDetails().getClientId() == null
                || clientSecrets.getDetails().getClientSecret() == null) {
            throw new IOException(
                    "Invalid OAuth client file at " + credentialsPath.toAbsolutePath()
                            + ". Expected a desktop client secret with a top-level 'installed' or 'web' entry.");
        }

        Path tokensDirectory = Path.of(uploadProperties.getTokensDir());
        Files.createDirectories(tokensDirectory);

        GoogleAuthorizationCodeFlow flow = new GoogleAuthorizationCodeFlow.Builder(
                httpTransport,
                jsonFactory,
                clientSecrets,
                SCOPES)
                .setDataStoreFactory(new FileDataStoreFactory(tokensDirectory.toFile()))
                .setAccessType("offline")
                .build();

        Credential storedCredential = flow.loadCredential(OAUTH_USER_ID);
        if (storedCredential != null) {
            return storedCredential;
        }

        String authorizationUrl = flow.newAuthorizationUrl()
                .setRedirectUri(OAUTH_CALLBACK_URI)
                .build();
        String authorizationCode = awaitAuthorizationCode(authorizationUrl);
        GoogleTokenResponse tokenResponse = flow.newTokenRequest(authorizationCode)
                .setRedirectUri(OAUTH_CALLBACK_URI)
                .execute();
        logger.info("Drive authorization stored in {}", tokensDirectory.toAbsolutePath());
        return flow.createAndStoreCredential(tokenResponse, OAUTH_USER_ID);
    }

    private String awaitAuthorizationCode(String authorizationUrl) throws IOException {
        CompletableFuture<String> codeFuture = new CompletableFuture<>();
        HttpServer server = HttpServer.create(new InetSocketAddress("localhost", OAUTH_CALLBACK_PORT), 0);

        server.createContext(OAUTH_CALLBACK_PATH, exchange -> {
            AuthorizationCodeResponseUrl responseUrl = new AuthorizationCodeResponseUrl(
                    OAUTH_CALLBACK_URI + "?" + exchange.getRequestURI().getRawQuery());

            String responseBody;
            if (responseUrl.getError() != null) {
                codeFuture.completeExceptionally(new IOException("Authorization failed: " + responseUrl.getError()));
                responseBody = "Drive authorization failed. You can close this window.";
            } else if (responseUrl.getCode() != null) {
                codeFuture.complete(responseUrl.getCode());
                responseBody = "Drive authorization complete. You can close this window.";
            } else {
                codeFuture.completeExceptionally(new IOException("Authorization code missing from callback."));
                responseBody = "Authorization code missing. You can close this window.";
            }

            byte[] bodyBytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "text/plain; charset=utf-8");
            exchange.sendResponseHeaders(200, bodyBytes.length);
            try (OutputStream outputStream = exchange.getResponseBody()) {
                outputStream.write(bodyBytes);
            }
        });

        server.start();
        // Headless render hosts have no browser, so the URL goes to the log.
        logger.warn("Drive upload needs authorization. Open this URL in a browser: {}", authorizationUrl);

        try {
            return codeFuture.get(AUTHORIZATION_TIMEOUT_MINUTES, TimeUnit.MINUTES);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException ioException) {
                throw ioException;
            }
            throw new IOException("Drive authorization failed.", e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("Drive authorization did not complete within "
                    + AUTHORIZATION_TIMEOUT_MINUTES + " minutes.", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Drive authorization interrupted.", e);
        } finally {
            server.stop(0);
        }
    }
}
