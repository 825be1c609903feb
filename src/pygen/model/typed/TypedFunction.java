package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A function definition. The name is null only for anonymous functions, and externalPython is null
 * unless the function is implemented by a foreign Python symbol.
 */
public class TypedFunction extends TypedDefinition {

	private final String name;
	private final Publicity publicity;
	private final List<TypedArg> arguments;
	private final List<TypedStatement> body;
	private final TypedExternal externalPython;
	private final Set<Target> implementations;

	public TypedFunction(SourceSpan location, String name, Publicity publicity, List<TypedArg> arguments,
	                     List<TypedStatement> body, TypedExternal externalPython, Set<Target> implementations) {
		super(location);
		this.name = name;
		this.publicity = publicity;
		this.arguments = arguments;
		this.body = body;
		this.externalPython = externalPython;
		this.implementations = implementations;
	}

	public String getName() {
		return name;
	}

	public Publicity getPublicity() {
		return publicity;
	}

	public List<TypedArg> getArguments() {
		return arguments;
	}

	public List<TypedStatement> getBody() {
		return body;
	}

	public TypedExternal getExternalPython() {
		return externalPython;
	}

	public Set<Target> getImplementations() {
		return implementations;
	}

	public boolean supports(Target target) {
		return implementations.contains(target);
	}

	@Override
	public <T, E extends Throwable> T accept(TypedDefinitionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedFunction that = (TypedFunction) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(publicity, that.publicity) &&
				Objects.equals(arguments, that.arguments) &&
				Objects.equals(body, that.body) &&
				Objects.equals(externalPython, that.externalPython) &&
				Objects.equals(implementations, that.implementations);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, publicity, arguments, body, externalPython, implementations);
	}
}
