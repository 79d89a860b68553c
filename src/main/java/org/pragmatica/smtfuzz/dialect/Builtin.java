package org.pragmatica.smtfuzz.dialect;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Theory symbols the fuzzer understands. Trees store the canonical (SMT-LIB 2.6)
 * name; parser and generator translate to and from the dialect lexeme.
 */
public enum Builtin {
    // Strings
    CONCAT("str.++", null, "Concat", Sort.STRING, Family.NONE, Sort.STRING, Sort.STRING),
    LENGTH("str.len", null, "Length", Sort.INT, Family.NONE, Sort.STRING),
    CHAR_AT("str.at", null, "CharAt", Sort.STRING, Family.NONE, Sort.STRING, Sort.INT),
    SUBSTRING("str.substr", null, "Substring", Sort.STRING, Family.NONE, Sort.STRING, Sort.INT, Sort.INT),
    CONTAINS("str.contains", null, "Contains", Sort.BOOL, Family.STRING_PREDICATE, Sort.STRING, Sort.STRING),
    PREFIX_OF("str.prefixof", null, "StartsWith", Sort.BOOL, Family.STRING_PREDICATE, Sort.STRING, Sort.STRING),
    SUFFIX_OF("str.suffixof", null, "EndsWith", Sort.BOOL, Family.STRING_PREDICATE, Sort.STRING, Sort.STRING),
    INDEX_OF("str.indexof", null, "Indexof", Sort.INT, Family.NONE, Sort.STRING, Sort.STRING, Sort.INT),
    REPLACE("str.replace", null, "Replace", Sort.STRING, Family.NONE, Sort.STRING, Sort.STRING, Sort.STRING),
    STR_TO_INT("str.to_int", "str.to.int", null, Sort.INT, Family.NONE, Sort.STRING),
    INT_TO_STR("str.from_int", "int.to.str", null, Sort.STRING, Family.NONE, Sort.INT),
    // Regular expressions
    STR_TO_RE("str.to_re", "str.to.re", "Str2Reg", Sort.REGLAN, Family.NONE, Sort.STRING),
    IN_RE("str.in_re", "str.in.re", "RegexIn", Sort.BOOL, Family.NONE, Sort.STRING, Sort.REGLAN),
    RE_STAR("re.*", null, "RegexStar", Sort.REGLAN, Family.REGEX_UNARY, Sort.REGLAN),
    RE_PLUS("re.+", null, "RegexPlus", Sort.REGLAN, Family.REGEX_UNARY, Sort.REGLAN),
    RE_OPT("re.opt", null, null, Sort.REGLAN, Family.REGEX_UNARY, Sort.REGLAN),
    RE_COMP("re.comp", "re.complement", null, Sort.REGLAN, Family.REGEX_UNARY, Sort.REGLAN),
    RE_UNION("re.union", null, "RegexUnion", Sort.REGLAN, Family.REGEX_BINARY, Sort.REGLAN, Sort.REGLAN),
    RE_CONCAT("re.++", null, "RegexConcat", Sort.REGLAN, Family.REGEX_BINARY, Sort.REGLAN, Sort.REGLAN),
    RE_INTER("re.inter", null, null, Sort.REGLAN, Family.REGEX_BINARY, Sort.REGLAN, Sort.REGLAN),
    RE_RANGE("re.range", null, "RegexCharRange", Sort.REGLAN, Family.NONE, Sort.STRING, Sort.STRING),
    RE_NONE("re.none", "re.nostr", null, Sort.REGLAN, Family.REGEX_CONSTANT),
    RE_ALL("re.all", null, null, Sort.REGLAN, Family.REGEX_CONSTANT),
    RE_ALLCHAR("re.allchar", null, null, Sort.REGLAN, Family.REGEX_CONSTANT),
    // Core
    TRUE("true", null, null, Sort.BOOL, Family.BOOL_CONSTANT),
    FALSE("false", null, null, Sort.BOOL, Family.BOOL_CONSTANT),
    NOT("not", null, null, Sort.BOOL, Family.NONE, Sort.BOOL),
    AND("and", null, null, Sort.BOOL, Family.BOOL_CONNECTIVE, Sort.BOOL, Sort.BOOL),
    OR("or", null, null, Sort.BOOL, Family.BOOL_CONNECTIVE, Sort.BOOL, Sort.BOOL),
    XOR("xor", null, null, Sort.BOOL, Family.BOOL_CONNECTIVE, Sort.BOOL, Sort.BOOL),
    IMPLIES("=>", null, null, Sort.BOOL, Family.NONE, Sort.BOOL, Sort.BOOL),
    EQUALS("=", null, null, Sort.BOOL, Family.EQUALITY),
    DISTINCT("distinct", null, null, Sort.BOOL, Family.EQUALITY),
    ITE("ite", null, null, Sort.UNKNOWN, Family.NONE, Sort.BOOL, Sort.UNKNOWN, Sort.UNKNOWN),
    // Integers
    PLUS("+", null, null, Sort.INT, Family.INT_ARITHMETIC, Sort.INT, Sort.INT),
    MINUS("-", null, null, Sort.INT, Family.INT_ARITHMETIC, Sort.INT, Sort.INT),
    TIMES("*", null, null, Sort.INT, Family.INT_ARITHMETIC, Sort.INT, Sort.INT),
    DIV("div", null, null, Sort.INT, Family.INT_DIVISION, Sort.INT, Sort.INT),
    MOD("mod", null, null, Sort.INT, Family.INT_DIVISION, Sort.INT, Sort.INT),
    ABS("abs", null, null, Sort.INT, Family.NONE, Sort.INT),
    LESS("<", null, null, Sort.BOOL, Family.INT_COMPARISON, Sort.INT, Sort.INT),
    LESS_EQUAL("<=", null, null, Sort.BOOL, Family.INT_COMPARISON, Sort.INT, Sort.INT),
    GREATER(">", null, null, Sort.BOOL, Family.INT_COMPARISON, Sort.INT, Sort.INT),
    GREATER_EQUAL(">=", null, null, Sort.BOOL, Family.INT_COMPARISON, Sort.INT, Sort.INT);

    /**
     * Groups of interchangeable operators with the same signature.
     */
    public enum Family {
        NONE,
        STRING_PREDICATE,
        REGEX_UNARY,
        REGEX_BINARY,
        REGEX_CONSTANT,
        BOOL_CONSTANT,
        BOOL_CONNECTIVE,
        EQUALITY,
        INT_ARITHMETIC,
        INT_DIVISION,
        INT_COMPARISON
    }

    private static final ImmutableMap<String, Builtin> BY_CANONICAL;
    private static final Map<Dialect, ImmutableMap<String, Builtin>> BY_LEXEME = new EnumMap<>(Dialect.class);

    static {
        var canonical = ImmutableMap.<String, Builtin>builder();
        for (var builtin : values()) {
            canonical.put(builtin.canonical, builtin);
        }
        BY_CANONICAL = canonical.buildOrThrow();

        for (var dialect : Dialect.values()) {
            var lexemes = ImmutableMap.<String, Builtin>builder();
            for (var builtin : values()) {
                lexemes.put(builtin.lexeme(dialect), builtin);
            }
            BY_LEXEME.put(dialect, lexemes.buildOrThrow());
        }
    }

    private final String canonical;
    private final String smt25;
    private final String smt20;
    private final Sort result;
    private final Family family;
    private final ImmutableList<Sort> arguments;

    Builtin(String canonical, String smt25, String smt20, Sort result, Family family, Sort... arguments) {
        this.canonical = canonical;
        this.smt25 = smt25 == null ? canonical : smt25;
        this.smt20 = smt20 == null ? this.smt25 : smt20;
        this.result = result;
        this.family = family;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    public String canonical() {
        return canonical;
    }

    public String lexeme(Dialect dialect) {
        return switch (dialect) {
            case SMT20 -> smt20;
            case SMT25 -> smt25;
            case SMT26 -> canonical;
        };
    }

    public Sort result() {
        return result;
    }

    /**
     * Expected sort of the argument at {@code index}; the last declared sort repeats for n-ary operators.
     */
    public Sort argument(int index) {
        if (arguments.isEmpty()) {
            return Sort.UNKNOWN;
        }
        return arguments.get(Math.min(index, arguments.size() - 1));
    }

    /**
     * Legacy {@code StartsWith}/{@code EndsWith} take the whole string first.
     */
    public boolean swapsOperands(Dialect dialect) {
        return dialect == Dialect.SMT20 && (this == PREFIX_OF || this == SUFFIX_OF);
    }

    /**
     * Whether the operands following {@code lexeme} were written in legacy order. A canonical
     * name keeps canonical order in every dialect.
     */
    public boolean swapsOperands(String lexeme, Dialect dialect) {
        return swapsOperands(dialect) && lexeme.equals(lexeme(dialect));
    }

    /**
     * Other operators of the same family, in declaration order.
     */
    public List<Builtin> siblings() {
        if (family == Family.NONE) {
            return List.of();
        }
        var siblings = ImmutableList.<Builtin>builder();
        for (var builtin : values()) {
            if (builtin != this && builtin.family == family) {
                siblings.add(builtin);
            }
        }
        return siblings.build();
    }

    public static Optional<Builtin> fromCanonical(String symbol) {
        return Optional.ofNullable(BY_CANONICAL.get(symbol));
    }

    /**
     * Resolve a symbol read in {@code dialect}. Canonical names are accepted in every dialect.
     */
    public static Optional<Builtin> fromLexeme(String symbol, Dialect dialect) {
        var builtin = BY_LEXEME.get(dialect).get(symbol);
        return builtin != null
               ? Optional.of(builtin)
               : fromCanonical(symbol);
    }
}
