package work.lcod.reshape.runtime;

/**
 * A public method looked up by name on a receiver, produced by reading a member that is
 * neither a record component, a getter nor a field. Invoked by a later call step.
 */
public record BoundMethod(Object receiver, String name) {
    @Override
    public String toString() {
        return "<method " + Reprs.typeName(receiver) + "." + name + ">";
    }
}
