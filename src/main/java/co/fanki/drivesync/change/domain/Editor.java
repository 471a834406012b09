package co.fanki.drivesync.change.domain;

import co.fanki.drivesync.shared.Preconditions;
import co.fanki.drivesync.shared.ValueObject;

/**
 * The person a Drive file modification is attributed to.
 *
 * <p>Used as the git author of the commit that carries the change. Both
 * parts are compared verbatim; no case folding or trimming.</p>
 *
 * @param name the display name
 * @param email the email address
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Editor(String name, String email) implements ValueObject {

    /** Validates both parts. */
    public Editor {
        Preconditions.requireNonNull(name, "Editor name is required");
        Preconditions.requireNonNull(email, "Editor email is required");
    }

    /**
     * Builds an identity from optional parts, each missing part taken
     * from the fallback identity.
     *
     * @param name the display name, may be null
     * @param email the email, may be null
     * @param fallback the identity supplying missing parts
     * @return the resolved identity
     */
    public static Editor resolve(final String name, final String email,
            final Editor fallback) {
        return new Editor(
                name != null ? name : fallback.name(),
                email != null ? email : fallback.email());
    }

    /**
     * Renders the identity the way git prints it.
     *
     * @return {@code Name <email>}
     */
    public String asGitIdentity() {
        return name + " <" + email + ">";
    }

}
