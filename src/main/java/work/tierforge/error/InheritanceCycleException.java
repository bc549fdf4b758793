package work.tierforge.error;

import java.util.List;

/**
 * An {@code extends} chain that revisits one of its own templates.
 */
public final class InheritanceCycleException extends ScaffoldException {
    private final List<String> chain;

    public InheritanceCycleException(List<String> chain) {
        super(
            "ERR_INHERITANCE_CYCLE",
            "Template inheritance cycle: " + String.join(" -> ", chain),
            List.of("Remove the extends tag that points back into the chain")
        );
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
