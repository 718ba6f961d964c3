package Engine;

import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import utils.InvariantViolationException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EqualityEngineTest {

    private TermManager tm;
    private EqualityEngine ee;
    private Sort u;
    private FuncDecl f;

    @Before
    public void setUp() {
        tm = new TermManager();
        ee = new EqualityEngine("test", tm.getAttributes());
        u = tm.mkSort("U");
        f = tm.mkFunc("f", u, u);
    }

    @After
    public void tearDown() {
        tm.close();
    }

    private List<Expr> classOf(Expr t) {
        List<Expr> out = new ArrayList<>();
        Iterator<Expr> it = ee.getEqClass(ee.getRepresentative(t));
        while (it.hasNext()) {
            out.add(it.next());
        }
        return out;
    }

    @Test
    public void addingATermAddsItsSubterms() {
        Expr a = tm.mkConst("a", u);
        Expr ffa = tm.mkApp(f, tm.mkApp(f, a));
        assertFalse(ee.hasTerm(a));

        ee.addTerm(ffa);

        assertTrue(ee.hasTerm(ffa));
        assertTrue(ee.hasTerm(tm.mkApp(f, a)));
        assertTrue(ee.hasTerm(a));
        assertEquals(3, ee.getNumClasses());
    }

    @Test
    public void mergesPropagateThroughCongruence() {
        Expr a = tm.mkConst("a", u);
        Expr b = tm.mkConst("b", u);
        Expr fa = tm.mkApp(f, a);
        Expr fb = tm.mkApp(f, b);
        Expr ffa = tm.mkApp(f, fa);
        Expr ffb = tm.mkApp(f, fb);
        ee.addTerm(ffa);
        ee.addTerm(ffb);
        assertFalse(ee.areEqual(fa, fb));

        ee.assertEquality(a, b);

        assertTrue(ee.areEqual(fa, fb));
        assertTrue(ee.areEqual(ffa, ffb));
    }

    @Test
    public void termsAddedAfterAMergeAreCongruent() {
        Expr a = tm.mkConst("a", u);
        Expr b = tm.mkConst("b", u);
        ee.assertEquality(a, b);

        ee.addTerm(tm.mkApp(f, a));
        ee.addTerm(tm.mkApp(f, b));

        assertTrue(ee.areEqual(tm.mkApp(f, a), tm.mkApp(f, b)));
    }

    @Test
    public void classesIterateFromTheRepresentativeInJoinOrder() {
        Expr a = tm.mkConst("a", u);
        Expr b = tm.mkConst("b", u);
        Expr c = tm.mkConst("c", u);
        ee.assertEquality(a, b);
        ee.assertEquality(c, a);

        assertEquals(c, ee.getRepresentative(b));
        assertEquals(List.of(c, a, b), classOf(a));
    }

    @Test
    public void valuesStayRepresentatives() {
        Expr x = tm.mkConst("x", tm.intSort());
        Expr three = tm.mkInt(3);
        ee.assertEquality(x, three);

        assertEquals(three, ee.getRepresentative(x));
        assertEquals(List.of(three, x), classOf(x));
    }

    @Test
    public void disequalitiesFollowMerges() {
        Expr a = tm.mkConst("a", u);
        Expr b = tm.mkConst("b", u);
        Expr c = tm.mkConst("c", u);
        ee.addTerm(c);
        ee.assertDisequality(a, b);
        assertTrue(ee.areDisequal(a, b, false));
        assertTrue(ee.areDisequal(b, a, false));
        assertFalse(ee.areDisequal(a, c, false));

        ee.assertEquality(c, a);
        assertTrue(ee.areDisequal(c, b, false));
        assertTrue(ee.isConsistent());
    }

    @Test
    public void distinctValuesAreDisequal() {
        Expr one = tm.mkInt(1);
        Expr two = tm.mkInt(2);
        ee.addTerm(one);
        ee.addTerm(two);

        assertTrue(ee.areDisequal(one, two, true));
    }

    @Test
    public void mergingDistinctValuesMakesTheEngineInconsistent() {
        ee.assertEquality(tm.mkInt(1), tm.mkInt(2));

        assertFalse(ee.isConsistent());
    }

    @Test
    public void mergingDisequalTermsMakesTheEngineInconsistent() {
        Expr a = tm.mkConst("a", u);
        Expr b = tm.mkConst("b", u);
        ee.assertDisequality(a, b);
        ee.assertEquality(a, b);

        assertFalse(ee.isConsistent());
    }

    @Test(expected = InvariantViolationException.class)
    public void representativeOfUnknownTermIsAContractViolation() {
        ee.getRepresentative(tm.mkConst("nowhere", u));
    }

    @Test(expected = InvariantViolationException.class)
    public void iteratingANonRepresentativeIsAContractViolation() {
        Expr a = tm.mkConst("a", u);
        Expr b = tm.mkConst("b", u);
        ee.assertEquality(a, b);

        ee.getEqClass(b);
    }
}
