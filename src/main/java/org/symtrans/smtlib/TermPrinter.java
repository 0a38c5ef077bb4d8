package org.symtrans.smtlib;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 把 {@link Term} 写成 SMT-LIB 文本。
 * <p>
 * daggify 模式下，同一项中出现多于一次的函数应用子项只写一次：
 * 按后序依次绑定为 {@code ?def_0}, {@code ?def_1}, ...，外层用嵌套的 let 引用。
 * 没有共享子项时两种模式输出相同。输出只依赖项的结构，因此是确定性的。
 */
public final class TermPrinter {

    private static final Logger logger = LoggerFactory.getLogger(TermPrinter.class);

    private static final String DEF_PREFIX = "?def_";

    private TermPrinter() {
    }

    public static String print(Term term, boolean daggify) {
        if (!daggify) {
            StringBuilder sb = new StringBuilder();
            write(term, sb, Map.of(), null);
            return sb.toString();
        }

        Map<Term, String> names = assignNames(term);
        if (names.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            write(term, sb, Map.of(), null);
            return sb.toString();
        }
        logger.debug("daggify: {} 个共享子项", names.size());

        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Term, String> entry : names.entrySet()) {
            sb.append("(let ((").append(entry.getValue()).append(' ');
            write(entry.getKey(), sb, names, entry.getKey());
            sb.append(")) ");
        }
        write(term, sb, names, null);
        sb.append(")".repeat(names.size()));
        return sb.toString();
    }

    /**
     * 统计出现多于一次的应用子项，并按后序分配名称。
     */
    private static Map<Term, String> assignNames(Term root) {
        Map<Term, Integer> occurrences = new HashMap<>();
        countOccurrences(root, occurrences);

        Map<Term, String> names = new LinkedHashMap<>();
        collectShared(root, occurrences, names, new HashSet<>());
        return names;
    }

    private static void countOccurrences(Term term, Map<Term, Integer> occurrences) {
        if (!term.isApplication()) {
            return;
        }
        int count = occurrences.merge(term, 1, Integer::sum);
        if (count == 1) {
            for (Term arg : term.getArgs()) {
                countOccurrences(arg, occurrences);
            }
        }
    }

    private static void collectShared(Term term, Map<Term, Integer> occurrences,
                                      Map<Term, String> names, Set<Term> visited) {
        if (!term.isApplication() || !visited.add(term)) {
            return;
        }
        for (Term arg : term.getArgs()) {
            collectShared(arg, occurrences, names, visited);
        }
        if (occurrences.get(term) > 1) {
            names.put(term, DEF_PREFIX + names.size());
        }
    }

    private static void write(Term term, StringBuilder sb, Map<Term, String> names, Term defining) {
        if (!term.isApplication()) {
            sb.append(term.getHead());
            return;
        }
        if (term != defining) {
            String name = names.get(term);
            if (name != null) {
                sb.append(name);
                return;
            }
        }
        sb.append('(').append(term.getHead());
        for (Term arg : term.getArgs()) {
            sb.append(' ');
            write(arg, sb, names, null);
        }
        sb.append(')');
    }
}
