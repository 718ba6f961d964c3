package Engine;

import com.microsoft.z3.Expr;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.RealSort;
import com.microsoft.z3.Sort;
import com.microsoft.z3.UninterpretedSort;

public class TypeUtils {

    /**
     * Every sort is a subtype of itself, and Int is a subtype of Real.
     */
    public static boolean isSubtypeOf(Sort sub, Sort sup) {
        if (sub == null || sup == null) {
            throw new RuntimeException("Sort cannot be null");
        }
        if (sub.equals(sup)) {
            return true;
        }
        return sub instanceof IntSort && sup instanceof RealSort;
    }

    public static boolean isSubtypeOf(Expr n, Sort sup) {
        return isSubtypeOf(n.getSort(), sup);
    }

    /**
     * True for user-declared (uninterpreted) sorts.
     */
    public static boolean isUserSort(Sort sort) {
        return sort instanceof UninterpretedSort;
    }
}
