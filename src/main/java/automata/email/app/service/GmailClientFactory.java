package automata.email.app.service;

import automata.email.app.config.MailActionProperties;
import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import org.springframework.stereotype.Component;

/**
 * Builds Gmail API clients authorized with a caller-supplied OAuth access token.
 */
@Component
public class GmailClientFactory {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();

    private final NetHttpTransport httpTransport;
    private final String applicationName;

    public GmailClientFactory(MailActionProperties properties) throws Exception {
        this.httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        this.applicationName = properties.getApplicationName();
    }

    public Gmail forAccessToken(String accessToken) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
            .setTransport(httpTransport)
            .setJsonFactory(JSON_FACTORY)
            .build();
        credential.setAccessToken(accessToken);

        return new Gmail.Builder(httpTransport, JSON_FACTORY, credential)
            .setApplicationName(applicationName)
            .build();
    }
}
