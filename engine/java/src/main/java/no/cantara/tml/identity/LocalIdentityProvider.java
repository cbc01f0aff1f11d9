package no.cantara.tml.identity;

import no.cantara.tml.model.HumanIdentity;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Identity provider backed by identities registered in this process.
 */
public class LocalIdentityProvider implements IdentityProvider {

    private final Map<String, HumanIdentity> byEmail = new ConcurrentHashMap<>();

    public LocalIdentityProvider register(HumanIdentity identity) {
        byEmail.put(key(identity.email()), identity);
        return this;
    }

    @Override
    public HumanIdentity resolve(String email) {
        HumanIdentity known = byEmail.get(key(email));
        return known != null ? known : new HumanIdentity(email.trim(), displayNameFor(email));
    }

    @Override
    public List<HumanIdentity> listAvailable() {
        return byEmail.values().stream()
                .sorted(Comparator.comparing(HumanIdentity::displayName, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /** {@code jane.doe@acme.com} and {@code jane_doe@acme.com} both become {@code Jane Doe}. */
    static String displayNameFor(String email) {
        String local = email.trim().split("@", 2)[0].replace('.', ' ').replace('_', ' ');
        return Arrays.stream(local.split(" "))
                .filter(part -> !part.isEmpty())
                .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT) + part.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    private static String key(String email) {
        if (email == null || !email.contains("@") || email.isBlank()) {
            throw new IllegalArgumentException("Not an e-mail address: '" + email + "'");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
