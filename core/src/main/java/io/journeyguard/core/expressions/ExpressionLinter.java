package io.journeyguard.core.expressions;

import io.journeyguard.core.model.Category;
import io.journeyguard.core.model.ExpressionSite;
import io.journeyguard.core.model.Finding;
import io.journeyguard.core.model.FixHint;
import io.journeyguard.core.registry.RegistryConstants;
import io.journeyguard.core.spi.AnalysisContext;
import io.journeyguard.core.spi.JourneyAnalyzer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical lint rules for expression values.
 *
 * <p>
 * Each rule is applied to every {@link ExpressionSite} before the next rule runs, so findings
 * are grouped by rule in the report. The checks are regex heuristics over the raw text; the
 * expression language is never parsed.
 */
public final class ExpressionLinter implements JourneyAnalyzer {

    static final Pattern INTERPOLATION = Pattern.compile("\\$\\{([^}]+)}");
    static final Pattern BACKTICK_SPAN = Pattern.compile("`([^`]*)`");
    static final Pattern DOUBLE_QUOTED = Pattern.compile("\"(?:[^\"\\\\]|\\\\.)*\"");
    static final Pattern SINGLE_QUOTED_STRING = Pattern.compile("'(?:[^'\\\\]|\\\\.)*'");

    private static final Pattern STD_IF = Pattern.compile("@std\\.if\\s*\\(");
    private static final Pattern STD_DEFAULT = Pattern.compile("@std\\.default\\s*\\(");
    private static final Pattern STD_NOW = Pattern.compile("@std\\.now\\s*\\(");
    private static final Pattern STD_CALL = Pattern.compile("@std\\.([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\(");
    private static final Pattern PARENTHESIZED_LOGIC = Pattern.compile("\\([^)]*(\\|\\||&&)[^)]*\\)");
    private static final Pattern LOGIC_WITH_ARITHMETIC =
            Pattern.compile("(\\|\\||&&).+[+\\-*/]|[+\\-*/].+(\\|\\||&&)");
    private static final Pattern SINGLE_QUOTED = Pattern.compile("'[^']*'");
    private static final Pattern BACKTICK_CONCATENATION =
            Pattern.compile("`[^`]+`\\s*\\+\\s*[a-zA-Z_][a-zA-Z0-9_.]*");

    private static final List<String> COMPOUND_OPERATORS = List.of("+=", "-=", "*=", "/=", "&=", "|=", "^=", "%=");
    private static final Set<String> INFORMATION_FIELDS = Set.of("action.text", "action.title", "action.button_text");

    /** One lint rule applied to one site. */
    @FunctionalInterface
    private interface Rule {
        void check(ExpressionSite site, RegistryConstants constants, List<Finding> out);
    }

    private final List<Rule> rules = List.of(
            ExpressionLinter::checkSyntax,
            ExpressionLinter::checkStdFunctions,
            ExpressionLinter::checkEscaping,
            ExpressionLinter::checkInterpolationComplexity,
            ExpressionLinter::checkStringAndCallStyle,
            ExpressionLinter::checkOperators,
            ExpressionLinter::checkInformationText);

    @Override
    public Category category() {
        return Category.EXPRESSIONS;
    }

    @Override
    public List<Finding> analyze(AnalysisContext context) {
        List<ExpressionSite> sites = ExpressionScanner.scan(context.workflow());
        RegistryConstants constants = context.registry().constants();
        List<Finding> findings = new ArrayList<>();
        for (Rule rule : rules) {
            for (ExpressionSite site : sites) {
                rule.check(site, constants, findings);
            }
        }
        return findings;
    }

    // --- Syntax and @std ---

    private static void checkSyntax(ExpressionSite site, RegistryConstants constants, List<Finding> out) {
        String value = site.value();
        if (isTemplate(value)) {
            Matcher matcher = INTERPOLATION.matcher(value);
            while (matcher.find()) {
                if (matcher.group(1).contains("'")) {
                    out.add(error(site, prefix(site) + "contains single quotes (') inside template literal "
                            + "interpolation. Single quotes are not supported inside template literals; use double "
                            + "quotes instead.\n  Wrong: `${error ? 'Failed' : 'Success'}`\n"
                            + "  Correct: `${error ? \"Failed\" : \"Success\"}`"));
                    break;
                }
            }
        }
        if (STD_IF.matcher(value).find()) {
            out.add(error(site, prefix(site) + "uses @std.if() which does not exist. Use the ternary operator "
                    + "instead: condition ? valueIfTrue : valueIfFalse"));
        }
        if (STD_DEFAULT.matcher(value).find()) {
            out.add(error(site, prefix(site) + "uses @std.default() which does not exist. Use logical OR or the "
                    + "ternary operator instead:\n  Correct: ${value || defaultValue}"));
        }
        if (STD_NOW.matcher(value).find()) {
            out.add(error(site, prefix(site) + "uses @std.now() which does not exist. Use @time.now() instead to "
                    + "get the current timestamp."));
        }
    }

    private static void checkStdFunctions(ExpressionSite site, RegistryConstants constants, List<Finding> out) {
        if (constants.validStdFunctions().isEmpty()) {
            return;
        }
        Matcher matcher = STD_CALL.matcher(site.value());
        while (matcher.find()) {
            String function = matcher.group(1);
            if (constants.validStdFunctions().contains(function)) {
                continue;
            }
            String suggestion = stdSuggestion(function);
            out.add(error(site, prefix(site) + "uses invalid @std function: '" + function + "'\n"
                    + "  Invalid: @std." + function + "(...)\n"
                    + "  Valid @std functions are: " + String.join(", ", new TreeSet<>(constants.validStdFunctions()))
                    + (suggestion.isEmpty() ? "" : "\n" + suggestion)));
        }
    }

    private static String stdSuggestion(String function) {
        switch (function) {
            case "is_null":
            case "isNull":
            case "isnull":
                return "  To check for null, use: `variable == null` or `variable != null`";
            case "isEmpty":
            case "is_empty":
            case "isempty":
                return "  To check if empty, use: `@std.len(variable) == 0`";
            case "concat":
            case "join":
                return "  To concatenate strings, use a template literal `${var1} ${var2}` or `var1 + var2`";
            case "toString":
            case "to_string":
            case "tostring":
                return "  To convert to string, use a template literal `${variable}` or `variable + \"\"`";
            default:
                return "";
        }
    }

    // --- Escaping and template complexity ---

    private static void checkEscaping(ExpressionSite site, RegistryConstants constants, List<Finding> out) {
        Matcher matcher = BACKTICK_SPAN.matcher(site.value());
        while (matcher.find()) {
            String inside = matcher.group(1);
            if (inside.contains("\\\"")) {
                String excerpt = inside.length() > 50 ? inside.substring(0, 50) : inside;
                out.add(error(site, prefix(site) + "has incorrectly escaped quotes inside backticks. Inside "
                        + "backticks, use \" not \\\" for quotes. Found: `" + excerpt + "...`"));
            }
        }
    }

    private static void checkInterpolationComplexity(
            ExpressionSite site, RegistryConstants constants, List<Finding> out) {
        if (!isTemplate(site.value())) {
            return;
        }
        Matcher matcher = INTERPOLATION.matcher(site.value());
        while (matcher.find()) {
            String content = matcher.group(1);
            if (PARENTHESIZED_LOGIC.matcher(content).find()) {
                out.add(error(site, prefix(site) + "has complex expression inside template literal.\n"
                        + "  Problem: ${" + content + "}\n"
                        + "  Nested parentheses with logical operators can cause parser errors. "
                        + "Break the expression down using set_variables."));
            } else if (LOGIC_WITH_ARITHMETIC.matcher(content).find()) {
                out.add(error(site, prefix(site) + "combines logical and arithmetic operators.\n"
                        + "  Problem: ${" + content + "}\n"
                        + "  Use set_variables to break it into separate steps."));
            }
        }
    }

    // --- String literals, statements and calls ---

    private static void checkStringAndCallStyle(ExpressionSite site, RegistryConstants constants, List<Finding> out) {
        String value = site.value();
        String cleaned = BACKTICK_SPAN.matcher(DOUBLE_QUOTED.matcher(value).replaceAll("")).replaceAll("");
        if (SINGLE_QUOTED.matcher(cleaned).find()) {
            out.add(error(site, prefix(site) + "contains single-quoted strings. Expressions should use double "
                    + "quotes for string literals.\n  Wrong: 'hello world'\n  Correct: \"hello world\""));
        }
        if (value.contains(";") && withoutStrings(value).contains(";")) {
            out.add(error(site, prefix(site) + "contains semicolons. Expressions should be single statements "
                    + "without semicolons."));
        }
        for (String namespace : constants.knownNamespaces()) {
            String ns = Pattern.quote(namespace);
            boolean bare = Pattern.compile("\\b" + ns + "\\.[a-zA-Z_][a-zA-Z0-9_]*\\s*\\(").matcher(value).find();
            if (bare && !Pattern.compile("@" + ns + "\\.[a-zA-Z_][a-zA-Z0-9_]*\\s*\\(").matcher(value).find()) {
                out.add(error(site, prefix(site) + "has function call using '" + namespace + "' namespace without "
                        + "@ prefix. Platform function calls must start with @.\n"
                        + "  Wrong: " + namespace + ".contains(...)\n"
                        + "  Correct: @" + namespace + ".contains(...)"));
                break;
            }
        }
        if (value.contains("===") || value.contains("!==")) {
            out.add(error(site, prefix(site) + "uses strict equality operators (=== or !==). Expressions use == "
                            + "and != for equality checks.\n  Wrong: variable === value\n"
                            + "  Correct: variable == value")
                    .withHint(FixHint.catalogue()));
        }
    }

    // --- Operators ---

    private static void checkOperators(ExpressionSite site, RegistryConstants constants, List<Finding> out) {
        String value = site.value();
        for (String operator : COMPOUND_OPERATORS) {
            if (value.contains(operator)) {
                out.add(error(site, prefix(site) + "uses compound assignment operator '" + operator + "', which "
                        + "is not supported.\n  Wrong: variable += 1\n  Correct: variable = variable + 1"));
                break;
            }
        }
        if (value.contains("++") || value.contains("--")) {
            out.add(error(site, prefix(site) + "uses increment/decrement operators (++ or --), which are not "
                    + "supported.\n  Wrong: counter++\n  Correct: counter = counter + 1"));
        }
        if (value.contains("%") && withoutStrings(value).contains("%")) {
            out.add(Finding.warning(Category.EXPRESSIONS, site.nodeId(), prefix(site) + "uses modulo operator (%). "
                            + "Verify that modulo is supported by the target platform version.")
                    .withField(site.path()));
        }
        if (value.contains("**")) {
            out.add(error(site, prefix(site) + "uses power operator (**), which is not supported for "
                    + "exponentiation."));
        }
        if (value.contains("~") && withoutStrings(value).contains("~")) {
            out.add(error(site, prefix(site) + "uses bitwise NOT operator (~), which is not supported."));
        }
    }

    // --- Information nodes ---

    private static void checkInformationText(ExpressionSite site, RegistryConstants constants, List<Finding> out) {
        if (!site.information() || !INFORMATION_FIELDS.contains(site.path())) {
            return;
        }
        String value = site.value();
        String problem = excessiveBackticking(value);
        if (problem != null) {
            out.add(Finding.error(Category.EXPRESSIONS, site.nodeId(), "Node " + site.nodeId()
                            + " (information) has excessive backticking in " + site.field() + " field. " + problem)
                    .withField(site.path())
                    .withHint(FixHint.catalogue()));
        }
        if ("text".equals(site.field())
                && (value.contains("\n") || value.contains("\r") || value.contains("\\n"))) {
            out.add(Finding.error(Category.EXPRESSIONS, site.nodeId(), "Node " + site.nodeId()
                            + " (information) has newlines in text expression. Information node expressions "
                            + "should not contain newlines.")
                    .withField(site.path()));
        }
    }

    /** Describes the excessive backticking in {@code value}, or returns {@code null} if there is none. */
    static String excessiveBackticking(String value) {
        if (value.startsWith("`` ") || value.startsWith("``\n") || value.endsWith(" ``") || value.endsWith("\n``")) {
            String inner = value.length() > 6 ? value.substring(3, value.length() - 3) : "";
            if (value.contains("+") && inner.contains("`")) {
                return "Expression has double backticks wrapping concatenated backticked segments. "
                        + "Run the fix command to repair it automatically.";
            }
            return "Expression has double backticks at start/end. Run the fix command to repair it automatically.";
        }
        if (BACKTICK_CONCATENATION.matcher(value).find()) {
            return "Expression uses inefficient string concatenation with individual backticked segments. "
                    + "Run the fix command to repair it automatically.";
        }
        return null;
    }

    // --- Helpers ---

    private static boolean isTemplate(String value) {
        return value.startsWith("`") && value.endsWith("`");
    }

    static String withoutStrings(String value) {
        return SINGLE_QUOTED_STRING.matcher(DOUBLE_QUOTED.matcher(value).replaceAll("")).replaceAll("");
    }

    private static String prefix(ExpressionSite site) {
        return "Node " + site.nodeId() + " field '" + site.path() + "' ";
    }

    private static Finding error(ExpressionSite site, String message) {
        return Finding.error(Category.EXPRESSIONS, site.nodeId(), message).withField(site.path());
    }
}
