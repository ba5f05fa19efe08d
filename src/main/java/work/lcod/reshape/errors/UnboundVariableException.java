package work.lcod.reshape.errors;

import java.util.NoSuchElementException;

public class UnboundVariableException extends NoSuchElementException {
    private final String name;

    public UnboundVariableException(String name) {
        super("No binding for \"" + name + "\"");
        this.name = name;
    }

    public String name() {
        return name;
    }
}
