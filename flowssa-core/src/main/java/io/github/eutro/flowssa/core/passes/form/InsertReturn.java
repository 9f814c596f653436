package io.github.eutro.flowssa.core.passes.form;

import io.github.eutro.flowssa.core.MalformedAstException;
import io.github.eutro.flowssa.core.ast.*;
import io.github.eutro.flowssa.core.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Makes the value a function returns explicit, by wrapping every value that falls off the end
 * of its body in a {@code return(...)}.
 * <p>
 * A trailing expression is returned directly; a trailing assignment is followed by returning
 * the variable assigned; a trailing loop, an empty body, or a missing {@code else} arm returns
 * {@code NULL}; a trailing {@code if} has both of its arms transformed.
 */
public class InsertReturn implements InPlaceIRPass<Function> {
    /**
     * An instance of this pass which leaves nested function definitions alone.
     */
    public static final InsertReturn INSTANCE = new InsertReturn(false);
    /**
     * An instance of this pass which also transforms nested function definitions.
     */
    public static final InsertReturn RECURSIVE = new InsertReturn(true);

    private final boolean recursive;

    private InsertReturn(boolean recursive) {
        this.recursive = recursive;
    }

    @Override
    public void runInPlace(Function function) {
        AstNode body = function.getBody();
        if (body == null) throw MalformedAstException.missing(function, "body");
        if (recursive) {
            transformNested(body);
        }
        function.setBody(transform(body));
    }

    private void transformNested(AstNode node) {
        for (AstNode child : node.children()) {
            if (child.kind() == Kind.FUNCTION) {
                runInPlace((Function) child);
            } else {
                transformNested(child);
            }
        }
    }

    private AstNode transform(AstNode node) {
        if (node.kind() == Kind.BRACE) {
            Brace brace = (Brace) node;
            List<AstNode> body = new ArrayList<>(brace.getBody());
            if (body.isEmpty()) {
                body.add(new Return(Literal.ofNull()));
            } else {
                body.addAll(tail(body.remove(body.size() - 1)));
            }
            brace.setBody(body);
            return brace;
        }
        List<AstNode> tail = tail(node);
        return tail.size() == 1 ? tail.get(0) : new Brace(tail);
    }

    private List<AstNode> tail(AstNode last) {
        List<AstNode> out = new ArrayList<>();
        switch (last.kind()) {
            case LITERAL:
            case SYMBOL:
            case CALL:
            case FUNCTION:
                out.add(new Return(last));
                break;
            case ASSIGN: {
                Symbol write = ((Assign) last).getWrite();
                if (write == null) throw MalformedAstException.missing(last, "target");
                out.add(last);
                out.add(new Return(write.copy()));
                break;
            }
            case FOR:
            case WHILE:
                out.add(last);
                out.add(new Return(Literal.ofNull()));
                break;
            case IF: {
                If anIf = (If) last;
                AstNode ifTrue = anIf.getTrue();
                if (ifTrue == null) throw MalformedAstException.missing(last, "true arm");
                anIf.setTrue(transform(ifTrue));
                AstNode ifFalse = anIf.getFalse();
                anIf.setFalse(ifFalse == null ? new Return(Literal.ofNull()) : transform(ifFalse));
                out.add(anIf);
                break;
            }
            case BRACE:
                out.add(transform(last));
                break;
            default:
                // break, next and return never fall through
                out.add(last);
        }
        return out;
    }
}
