package io.github.cyfko.restql.core.dispatch;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The seven conventional actions a resource can expose. All are disabled until a
 * {@link ResourceConfig} enables them.
 */
public enum ApiAction {
    INDEX,
    CREATE,
    SHOW,
    UPDATE,
    DESTROY,
    ASSOCIATED,
    REMOTED;

    /**
     * @return lower-case action name, as used in declarations and logs
     */
    public String actionName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param name action name, case-insensitive
     * @return the matching action, empty for unknown names
     */
    public static Optional<ApiAction> fromName(String name) {
        return Arrays.stream(values())
                .filter(a -> a.name().equalsIgnoreCase(name == null ? "" : name.trim()))
                .findFirst();
    }
}
