package work.lcod.reshape.runtime;

/**
 * Subtype relation used by the {@link TypeRegistry} to place types in its specificity forest.
 */
@FunctionalInterface
public interface TypeHierarchy {
    TypeHierarchy JAVA = (candidate, ancestor) -> ancestor.isAssignableFrom(candidate);

    boolean isSubtype(Class<?> candidate, Class<?> ancestor);
}
