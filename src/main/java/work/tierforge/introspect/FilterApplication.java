package work.tierforge.introspect;

/**
 * One {@code operand|filter} occurrence. {@code operandName} is set only when the operand is a bare
 * variable name.
 */
public record FilterApplication(String filterName, String operandName, int line) {}
