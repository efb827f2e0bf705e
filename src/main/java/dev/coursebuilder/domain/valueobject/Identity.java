package dev.coursebuilder.domain.valueobject;

/**
 * The authenticated caller, handed to every service call by the web layer.
 * Course Builder keys students by their account email, so {@code id} and
 * {@code email} coincide for accounts created through registration.
 */
public record Identity(String id, String email) {
    public Identity {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("identity id required");
    }

    public static Identity of(String principalName) {
        return new Identity(principalName, principalName != null && principalName.contains("@") ? principalName : null);
    }
}
