/*
 * Copyright (C) 2021 Vaticle
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 *
 */

package com.vaticle.typematch.logic.term;

import com.vaticle.typematch.common.exception.TypeMatchException;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.vaticle.typematch.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;
import static com.vaticle.typematch.logic.term.BooleanTerm.FALSE;
import static com.vaticle.typematch.logic.term.BooleanTerm.TRUE;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class BooleanTermTest {

    @Test
    public void true_and_false_are_distinct_singletons() {
        assertNotEquals(TRUE, FALSE);
        assertEquals(TRUE, TRUE);
        assertEquals(FALSE, FALSE);
        assertTrue(TRUE.isTrue());
        assertTrue(FALSE.isFalse());
        assertTrue(TRUE.isConstant());
        assertFalse(Eq.of("a", "b").isConstant());
    }

    @Test
    public void equality_is_symmetric() {
        assertEquals(Eq.of("a", "b"), Eq.of("b", "a"));
        assertEquals(Eq.of("a", "b").hashCode(), Eq.of("b", "a").hashCode());
        assertEquals(Eq.of("x", "y").hashCode(), Eq.of("y", "x").hashCode());
        assertNotEquals(Eq.of("a", "c"), Eq.of("a", "b"));
    }

    @Test
    public void equality_keeps_the_greater_name_on_the_left() {
        Eq eq = Eq.of("a", "b").asEq();
        assertEquals("b", eq.left());
        assertEquals("a", eq.right());
    }

    @Test
    public void equality_of_a_name_with_itself_is_true() {
        assertEquals(TRUE, Eq.of("a", "a"));
        assertNotEquals(Eq.of("a", "a"), Eq.of("a", "b"));
    }

    @Test
    public void and_normalises_constants_and_singletons() {
        BooleanTerm ab = Eq.of("a", "b");
        assertEquals(TRUE, And.of());
        assertEquals(TRUE, And.of(TRUE));
        assertEquals(TRUE, And.of(TRUE, TRUE));
        assertEquals(FALSE, And.of(TRUE, FALSE));
        assertEquals(ab, And.of(ab));
        assertEquals(ab, And.of(ab, TRUE));
        assertEquals(FALSE, And.of(ab, FALSE));
    }

    @Test
    public void or_normalises_constants_and_singletons() {
        BooleanTerm ab = Eq.of("a", "b");
        assertEquals(FALSE, Or.of());
        assertEquals(TRUE, Or.of(TRUE));
        assertEquals(TRUE, Or.of(TRUE, TRUE));
        assertEquals(TRUE, Or.of(TRUE, FALSE));
        assertEquals(ab, Or.of(ab));
        assertEquals(ab, Or.of(ab, FALSE));
        assertEquals(TRUE, Or.of(ab, TRUE));
    }

    @Test
    public void and_and_or_flatten_nested_terms_of_their_own_kind() {
        BooleanTerm ab = Eq.of("a", "b");
        BooleanTerm bc = Eq.of("b", "c");
        BooleanTerm cd = Eq.of("c", "d");
        BooleanTerm conjunction = And.of(ab, And.of(bc, cd));
        assertEquals(Set.of(ab, bc, cd), conjunction.asAnd().terms());
        assertEquals(And.of(ab, bc, cd), conjunction);

        BooleanTerm disjunction = Or.of(Or.of(ab, bc), cd, Or.of(cd));
        assertEquals(Set.of(ab, bc, cd), disjunction.asOr().terms());

        BooleanTerm mixed = And.of(ab, Or.of(bc, cd));
        assertEquals(2, mixed.asAnd().terms().size());
        assertTrue(mixed.asAnd().terms().contains(Or.of(cd, bc)));
    }

    @Test
    public void construction_order_is_irrelevant() {
        BooleanTerm ab = Eq.of("a", "b");
        BooleanTerm bc = Eq.of("b", "c");
        BooleanTerm cd = Eq.of("c", "d");
        assertEquals(Or.of(ab, bc), Or.of(bc, ab));
        assertEquals(And.of(ab, bc), And.of(bc, ab));
        assertEquals(And.of(ab, bc, cd), And.of(cd, ab, bc));
        assertEquals(Or.of(ab, bc, cd).hashCode(), Or.of(bc, cd, ab).hashCode());
        assertEquals(And.of(ab, bc, cd).hashCode(), And.of(bc, cd, ab).hashCode());
        assertNotEquals(And.of(ab, bc), Or.of(ab, bc));
    }

    @Test
    public void nested_terms_are_equal_to_themselves() {
        BooleanTerm nested = Or.of(And.of(Eq.of("a", "u"), Eq.of("b", "v")), And.of(Eq.of("c", "w"), Eq.of("d", "x")));
        assertEquals(nested, nested);
        assertEquals(nested, Or.of(And.of(Eq.of("x", "d"), Eq.of("w", "c")), And.of(Eq.of("v", "b"), Eq.of("u", "a"))));
    }

    @Test
    public void pivots_of_a_disjunction_are_unioned() {
        BooleanTerm equation = Or.of(Eq.of("x", "0"), Eq.of("x", "1"));
        assertEquals(Set.of("0", "1"), equation.extractPivots().get("x"));
    }

    @Test
    public void pivots_of_a_conjunction_are_intersected() {
        BooleanTerm equation = And.of(Eq.of("x", "0"), Or.of(Eq.of("x", "0"), Eq.of("x", "1")));
        assertEquals(Set.of("0"), equation.extractPivots().get("x"));
        assertEquals(Set.of("0"), And.of(Eq.of("x", "0"), Eq.of("x", "0")).extractPivots().get("x"));
    }

    @Test
    public void pivots_of_a_conjunction_keep_names_mentioned_by_a_single_branch() {
        BooleanTerm equation = And.of(Eq.of("x", "0"), Eq.of("y", "1"));
        Map<String, Set<String>> pivots = equation.extractPivots();
        assertEquals(Set.of("0"), pivots.get("x"));
        assertEquals(Set.of("1"), pivots.get("y"));
    }

    @Test
    public void pivots_of_a_disjunction_skip_names_missing_from_a_branch() {
        BooleanTerm equation = Or.of(And.of(Eq.of("x", "0"), Eq.of("y", "1")), Eq.of("x", "2"));
        Map<String, Set<String>> pivots = equation.extractPivots();
        assertEquals(Set.of("0", "2"), pivots.get("x"));
        assertFalse(pivots.containsKey("y"));
    }

    @Test
    public void pivots_of_an_equality_map_both_sides() {
        Map<String, Set<String>> pivots = Eq.of("x", "y").extractPivots();
        assertEquals(Set.of("y"), pivots.get("x"));
        assertEquals(Set.of("x"), pivots.get("y"));
        assertTrue(TRUE.extractPivots().isEmpty());
    }

    @Test
    public void pivots_follow_nested_branches() {
        // t = v1 | (t = v2 & (t = v2 | t = v3))
        BooleanTerm equation = Or.of(
                Eq.of("t", "v1"),
                And.of(Eq.of("t", "v2"), Or.of(Eq.of("t", "v2"), Eq.of("t", "v3")))
        );
        assertEquals(Set.of("v1", "v2"), equation.extractPivots().get("t"));
    }

    @Test
    public void simplify_drops_values_no_longer_possible() {
        BooleanTerm equation = Or.of(Eq.of("x", "0"), Eq.of("x", "1"));
        assertEquals(Eq.of("x", "0"), equation.simplify(Map.of("x", Set.of("0"))));
        assertEquals(equation, equation.simplify(Map.of("x", Set.of("0", "1"))));
    }

    @Test
    public void simplify_equality_against_its_candidates() {
        assertEquals(FALSE, Eq.of("x", "0").simplify(Map.of("x", Set.of("1"))));
        assertEquals(Eq.of("x", "0"), Eq.of("x", "0").simplify(Map.of("x", Set.of("0"))));
        assertEquals(FALSE, Eq.of("x", "0").simplify(Map.of()));
    }

    @Test
    public void simplify_equality_of_two_variables_through_a_common_value() {
        Map<String, Set<String>> values = Map.of("x", Set.of("0", "1"), "y", Set.of("1", "2"));
        assertEquals(And.of(Eq.of("x", "1"), Eq.of("y", "1")), Eq.of("x", "y").simplify(values));
    }

    @Test
    public void simplify_equality_of_two_variables_with_several_common_values() {
        Map<String, Set<String>> values = Map.of("x", Set.of("0", "1", "2"), "y", Set.of("1", "2"));
        BooleanTerm expected = Or.of(And.of(Eq.of("x", "1"), Eq.of("y", "1")), And.of(Eq.of("x", "2"), Eq.of("y", "2")));
        assertEquals(expected, Eq.of("x", "y").simplify(values));
        assertEquals(FALSE, Eq.of("x", "y").simplify(Map.of("x", Set.of("0"), "y", Set.of("1"))));
    }

    @Test
    public void simplify_renormalises_conjunctions() {
        BooleanTerm equation = And.of(Eq.of("x", "0"), Eq.of("y", "1"));
        assertEquals(FALSE, equation.simplify(Map.of("x", Set.of("1"), "y", Set.of("1"))));
        assertEquals(equation, equation.simplify(Map.of("x", Set.of("0"), "y", Set.of("1"))));
        BooleanTerm disjunction = Or.of(Eq.of("x", "0"), Eq.of("y", "1"));
        assertEquals(Eq.of("y", "1"), disjunction.simplify(Map.of("x", Set.of("1"), "y", Set.of("1"))));
    }

    @Test
    public void casting_to_the_wrong_kind_throws() {
        try {
            Eq.of("a", "b").asAnd();
            fail();
        } catch (TypeMatchException e) {
            assertEquals(ILLEGAL_CAST, e.errorMessage());
        }
    }

    @Test
    public void terms_render_deterministically() {
        assertEquals("b == a", Eq.of("a", "b").toString());
        assertEquals("(b == a & c == b)", And.of(List.of(Eq.of("c", "b"), Eq.of("a", "b"))).toString());
        assertEquals("(b == a | c == b)", Or.of(List.of(Eq.of("c", "b"), Eq.of("a", "b"))).toString());
    }
}
