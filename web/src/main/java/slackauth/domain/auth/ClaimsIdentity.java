package slackauth.domain.auth;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Optional;

/**
 * The identity handed to the sign-in manager.
 */
public record ClaimsIdentity(String authenticationType, List<Claim> claims, String nameClaimType, String roleClaimType) {
    @JsonCreator
    public ClaimsIdentity {
        claims = List.copyOf(claims);
    }

    public ClaimsIdentity(final String authenticationType, final List<Claim> claims) {
        this(authenticationType, claims, ClaimTypes.NAME, ClaimTypes.ROLE);
    }

    public Optional<String> findFirst(final String claimType) {
        return claims.stream()
                .filter(claim -> claim.type().equals(claimType))
                .map(Claim::value)
                .findFirst();
    }

    @JsonIgnore
    public Optional<String> getName() {
        return findFirst(nameClaimType);
    }

    /**
     * A copy carrying the same claims under another authentication type.
     */
    public ClaimsIdentity withAuthenticationType(final String newAuthenticationType) {
        return new ClaimsIdentity(newAuthenticationType, claims, nameClaimType, roleClaimType);
    }
}
