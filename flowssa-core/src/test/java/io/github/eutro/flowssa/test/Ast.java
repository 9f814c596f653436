package io.github.eutro.flowssa.test;

import io.github.eutro.flowssa.core.ast.*;

import java.util.Arrays;
import java.util.Collections;

/**
 * Shorthand for building ASTs in tests.
 */
public class Ast {
    public static Symbol sym(String name) {
        return new Symbol(name);
    }

    public static Literal lit(Object value) {
        return new Literal(value);
    }

    public static Literal nul() {
        return Literal.ofNull();
    }

    public static Assign assign(String name, AstNode value) {
        return new Assign(sym(name), value);
    }

    public static Call call(String fn, AstNode... args) {
        return new Call(fn, args);
    }

    public static Brace brace(AstNode... body) {
        return new Brace(body);
    }

    public static If if_(AstNode condition, AstNode ifTrue) {
        return new If(condition, ifTrue);
    }

    public static If if_(AstNode condition, AstNode ifTrue, AstNode ifFalse) {
        return new If(condition, ifTrue, ifFalse);
    }

    public static While while_(AstNode condition, AstNode body) {
        return new While(condition, body);
    }

    public static While repeat(AstNode body) {
        return While.repeat(body);
    }

    public static For for_(String variable, AstNode iterable, AstNode body) {
        return new For(sym(variable), iterable, body);
    }

    public static Break break_() {
        return new Break();
    }

    public static Next next() {
        return new Next();
    }

    public static Return return_(AstNode value) {
        return new Return(value);
    }

    public static Function function(String[] params, AstNode... body) {
        return new Function(Arrays.asList(params), brace(body));
    }

    public static Function function(AstNode... body) {
        return new Function(Collections.emptyList(), brace(body));
    }

    public static Call rnorm() {
        return call("rnorm", lit(1.0));
    }

    public static Call range(int from, int to) {
        return call(":", lit(from), lit(to));
    }
}
