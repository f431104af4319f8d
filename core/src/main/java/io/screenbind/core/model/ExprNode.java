package io.screenbind.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.List;
import java.util.Objects;

/**
 * Abstract syntax tree for binding expressions.
 *
 * <p>
 * A sealed hierarchy: the evaluator and the static analysis helpers can rely on these seven
 * variants being the only node shapes. Trees are immutable, acyclic and finite; nesting depth is
 * bounded by the parser and re-checked by the evaluator.
 */
public sealed interface ExprNode {

    /** A constant: number, string, boolean or null. */
    record Literal(JsonNode value) implements ExprNode {
        public Literal {
            value = value != null ? value : NullNode.getInstance();
        }
    }

    /** A dotted reference; the first segment is the namespace root. */
    record Path(List<String> segments) implements ExprNode {
        public Path {
            Objects.requireNonNull(segments, "segments must not be null");
            if (segments.isEmpty()) {
                throw new IllegalArgumentException("Path requires at least one segment");
            }
            segments = List.copyOf(segments);
        }

        /** Segments joined with {@code .}. */
        public String dotted() {
            return String.join(".", segments);
        }
    }

    /** A call into the function table. */
    record Call(String name, List<ExprNode> args) implements ExprNode {
        public Call {
            Objects.requireNonNull(name, "name must not be null");
            args = List.copyOf(args);
        }
    }

    record Binary(String op, ExprNode left, ExprNode right) implements ExprNode {
        public Binary {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record Unary(String op, ExprNode operand) implements ExprNode {
        public Unary {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    record Ternary(ExprNode condition, ExprNode consequent, ExprNode alternate) implements ExprNode {
        public Ternary {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(consequent, "consequent must not be null");
            Objects.requireNonNull(alternate, "alternate must not be null");
        }
    }

    record ArrayLiteral(List<ExprNode> elements) implements ExprNode {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }
    }
}
