package Engine;

import com.microsoft.z3.Expr;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Static helpers over Z3 terms. Traversals use explicit stacks so deep terms do not
 * overflow the Java stack.
 */
public class TermUtil {

    private static final Expr[] NO_CHILDREN = new Expr[0];

    /**
     * Children of a term. Only applications have children; bound variables and
     * quantifiers are treated as leaves.
     */
    public static Expr[] children(Expr n) {
        if (!n.isApp() || n.getNumArgs() == 0) {
            return NO_CHILDREN;
        }
        return n.getArgs();
    }

    /**
     * Syntactic constant (a value): numerals, true/false and uninterpreted constants.
     * Two distinct values are never equal.
     */
    public static boolean isConstValue(TermAttributes attrs, Expr n) {
        if (attrs.isUninterpretedConstant(n)) {
            return true;
        }
        // numerals are not applications in Z3
        return n.isNumeral() || (n.isApp() && (n.isTrue() || n.isFalse()));
    }

    /**
     * Leaves have depth 0, an application has 1 + the maximum depth of its children.
     */
    public static int getTermDepth(TermAttributes attrs, Expr n) {
        Map<Expr, Integer> memo = attrs.getTermDepthCache();
        Integer cached = memo.get(n);
        if (cached != null) {
            return cached;
        }
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(n);
        while (!stack.isEmpty()) {
            Expr cur = stack.peek();
            if (memo.containsKey(cur)) {
                stack.pop();
                continue;
            }
            Expr[] kids = children(cur);
            boolean ready = true;
            int maxChild = -1;
            for (Expr k : kids) {
                Integer d = memo.get(k);
                if (d == null) {
                    stack.push(k);
                    ready = false;
                } else {
                    maxChild = Math.max(maxChild, d);
                }
            }
            if (ready) {
                memo.put(cur, maxChild + 1);
                stack.pop();
            }
        }
        return memo.get(n);
    }

    public static boolean containsUninterpretedConstant(TermAttributes attrs, Expr n) {
        return containsMatching(n, attrs::isUninterpretedConstant);
    }

    /**
     * Whether n contains an instantiation constant, i.e. is not ground for instantiation.
     */
    public static boolean hasInstConstAttr(TermAttributes attrs, Expr n) {
        Map<Expr, Boolean> memo = attrs.getHasInstConstCache();
        Boolean cached = memo.get(n);
        if (cached != null) {
            return cached;
        }
        boolean result = containsMatching(n, attrs::isInstConstant);
        memo.put(n, result);
        return result;
    }

    static boolean containsMatching(Expr n, Predicate<Expr> match) {
        Set<Expr> visited = new HashSet<>();
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(n);
        while (!stack.isEmpty()) {
            Expr cur = stack.pop();
            if (!visited.add(cur)) {
                continue;
            }
            if (match.test(cur)) {
                return true;
            }
            for (Expr k : children(cur)) {
                stack.push(k);
            }
        }
        return false;
    }
}
