/*
 * AACalc - Asset Allocation Calculator
 * Copyright (C) 2009, 2011-2017 Gordon Irlam
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.gordoni.retsim;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WithdrawalSequencerTest
{
        private static ScenarioState state()
        {
                // tax deferred, tax free, taxable with half its value basis, cash
                return new ScenarioState(new AssetBuckets(100000, 50000, 40000, 20000, 10000));
        }

        @Test
        @DisplayName("Cash is spent first, then taxable, then tax deferred, then tax free")
        void ordering()
        {
                ScenarioState s = state();
                WithdrawalPlan small = WithdrawalSequencer.plan(s, 5000, 0);
                assertEquals(5000, small.from_cash, 1e-9);
                assertEquals(0, small.from_capital_gains, 1e-9);

                WithdrawalPlan mid = WithdrawalSequencer.plan(s, 30000, 0);
                assertEquals(10000, mid.from_cash, 1e-9);
                assertEquals(20000, mid.from_capital_gains, 1e-9);
                assertEquals(10000, mid.realized_gains, 1e-9);
                assertEquals(0, mid.from_tax_deferred, 1e-9);

                WithdrawalPlan large = WithdrawalSequencer.plan(s, 180000, 0);
                assertEquals(100000, large.from_tax_deferred, 1e-9);
                assertEquals(30000, large.from_tax_free, 1e-9);
                assertFalse(large.exhausted);
                assertEquals(180000, large.total(), 1e-9);
        }

        @Test
        @DisplayName("The required distribution comes first and counts toward the need")
        void rmdFirst()
        {
                ScenarioState s = state();
                WithdrawalPlan plan = WithdrawalSequencer.plan(s, 15000, 4000);
                assertEquals(4000, plan.rmd, 1e-9);
                assertEquals(10000, plan.from_cash, 1e-9);
                assertEquals(1000, plan.from_capital_gains, 1e-9);
                assertEquals(4000, plan.from_tax_deferred, 1e-9);

                WithdrawalPlan excess = WithdrawalSequencer.plan(s, 1000, 4000);
                assertEquals(4000, excess.total(), 1e-9);
                assertEquals(0, excess.from_cash, 1e-9);
        }

        @Test
        @DisplayName("Asking for more than everything exhausts the buckets")
        void exhausted()
        {
                ScenarioState s = state();
                WithdrawalPlan plan = WithdrawalSequencer.plan(s, 500000, 0);
                assertTrue(plan.exhausted);
                assertEquals(s.total(), plan.total(), 1e-9);
                WithdrawalSequencer.apply(s, plan);
                assertEquals(0, s.total(), 1e-9);
                assertEquals(0, s.capital_gains_basis, 1e-9);
        }

        @Test
        @DisplayName("Selling part of the taxable account reduces its basis in proportion")
        void basisReduction()
        {
                ScenarioState s = state();
                WithdrawalSequencer.apply(s, WithdrawalSequencer.plan(s, 20000, 0));
                assertEquals(0, s.cash, 1e-9);
                assertEquals(30000, s.capital_gains, 1e-9);
                assertEquals(15000, s.capital_gains_basis, 1e-9);
                assertEquals(0.5, s.gain_fraction(), 1e-12);
        }

        @Test
        @DisplayName("Cash earns the cash yield while the other buckets earn the portfolio return")
        void growth()
        {
                ScenarioState s = state();
                s.grow(0.10, 0.02);
                assertEquals(110000, s.tax_deferred, 1e-9);
                assertEquals(55000, s.tax_free, 1e-9);
                assertEquals(44000, s.capital_gains, 1e-9);
                assertEquals(20000, s.capital_gains_basis, 1e-9);
                assertEquals(10200, s.cash, 1e-9);
        }
}
