package com.ralphtown.core.clone;

import org.eclipse.jgit.api.errors.InvalidRemoteException;
import org.eclipse.jgit.errors.TransportException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;

/**
 * Maps JGit clone failures onto {@link CloneFailure}. Nothing outside this class
 * looks at JGit's exception types.
 * <p>
 * JGit reports authentication problems as {@link TransportException}s whose
 * message names the problem; the URL's scheme decides whether that is an SSH or
 * an HTTPS failure.
 */
public final class CloneErrorClassifier {

    static final List<String> SSH_HELP = List.of(
            "Ensure your SSH key is added to ssh-agent: ssh-add ~/.ssh/id_ed25519",
            "Verify your key is added to GitHub: ssh -T git@github.com",
            "If using a passphrase, the ssh-agent must have the key unlocked"
    );

    static final List<String> HTTPS_HELP = List.of(
            "HTTPS cloning requires a Personal Access Token (PAT)",
            "Create a PAT at GitHub Settings > Developer Settings > Tokens",
            "Use the PAT as password when prompted, or configure git credential helper"
    );

    private static final List<String> AUTH_MARKERS = List.of(
            "auth fail", "not authorized", "authentication", "credentialsprovider",
            "permission denied", "userauth", "401", "403"
    );

    private static final List<String> NETWORK_MARKERS = List.of(
            "connection refused", "connection reset", "timed out", "unknown host",
            "could not resolve", "network is unreachable", "no route to host"
    );

    private CloneErrorClassifier() {}

    public static CloneException classify(String url, Exception error) {
        String detail = rootMessage(error);

        if (hasNetworkCause(error)) {
            return new CloneException(CloneFailure.NETWORK_ERROR, detail, List.of(), error);
        }
        if (isTransport(error) && containsAny(chainText(error), AUTH_MARKERS)) {
            if (isSshUrl(url)) {
                return new CloneException(CloneFailure.SSH_AUTH_FAILED, detail, SSH_HELP, error);
            }
            if (isHttpUrl(url)) {
                return new CloneException(CloneFailure.HTTPS_AUTH_FAILED, detail, HTTPS_HELP, error);
            }
        }
        if (isTransport(error) && !(error instanceof InvalidRemoteException)
                && containsAny(chainText(error), NETWORK_MARKERS)) {
            return new CloneException(CloneFailure.NETWORK_ERROR, detail, List.of(), error);
        }
        return new CloneException(CloneFailure.OPERATION_FAILED, detail, List.of(), error);
    }

    static boolean isSshUrl(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("ssh://") || lower.startsWith("git+ssh://")) {
            return true;
        }
        // scp-like syntax: user@host:path
        int colon = url.indexOf(':');
        return !lower.contains("://") && colon > 0 && url.substring(0, colon).contains("@");
    }

    static boolean isHttpUrl(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("https://") || lower.startsWith("http://");
    }

    private static boolean isTransport(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TransportException || t instanceof org.eclipse.jgit.api.errors.TransportException) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasNetworkCause(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof UnknownHostException || t instanceof ConnectException
                    || t instanceof NoRouteToHostException || t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String chainText(Throwable error) {
        StringBuilder sb = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null) {
                sb.append(t.getMessage().toLowerCase(Locale.ROOT)).append('\n');
            }
        }
        return sb.toString();
    }

    private static boolean containsAny(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static String rootMessage(Throwable error) {
        String message = error.getMessage();
        for (Throwable t = error.getCause(); t != null; t = t.getCause()) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                message = t.getMessage();
            }
        }
        return message != null ? message : error.getClass().getSimpleName();
    }
}
