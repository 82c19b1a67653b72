package pass;

import java.util.function.Supplier;

/**
 * pass type factory
 */
public interface PassType<T extends Pass> {
    /* constructor */
    Supplier<T> constructor();

    /** default factory method: constructor().get() */
    default T create() {
        return constructor().get();
    }

    /** the name used on the command line and in -Dir.passes */
    default String getName() {
        return ((Enum<?>) this).name().toLowerCase();
    }

    /**
     * Look a pass type up by its command-line name.
     *
     * @return the matching constant, or null
     */
    static <E extends Enum<E> & PassType<?>> E byName(Class<E> types, String name) {
        String key = name.trim().toLowerCase();
        for (E type : types.getEnumConstants()) {
            if (type.getName().equals(key)) {
                return type;
            }
        }
        return null;
    }
}
