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
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GuardrailsTest
{
        private Config config;

        @BeforeEach
        void setUp()
        {
                config = new Config();
        }

        @Test
        @DisplayName("The first withdrawal sets the initial rate when none is given")
        void initialRateFromFirstYear()
        {
                Guardrails gr = new Guardrails(config, 0);
                assertEquals(Double.NaN, gr.initial_rate());
                assertSame(SpendingState.NORMAL, gr.update(40000, 1000000, 30));
                assertEquals(0.04, gr.initial_rate(), 1e-12);
                assertEquals(1, gr.multiplier());
        }

        @Test
        @DisplayName("Crossing the upper guardrail cuts discretionary spending")
        void upperGuardrailCuts()
        {
                Guardrails gr = new Guardrails(config, 0.04);
                assertSame(SpendingState.NORMAL, gr.update(47000, 1000000, 30));
                assertSame(SpendingState.CAPITAL_PRESERVATION, gr.update(50000, 1000000, 30));
                assertEquals(0.9, gr.multiplier(), 1e-12);
                assertEquals(1, gr.cuts());
        }

        @Test
        @DisplayName("No cuts once the horizon is short")
        void noCutsNearEnd()
        {
                Guardrails gr = new Guardrails(config, 0.04);
                assertSame(SpendingState.NORMAL, gr.update(80000, 1000000, config.capital_preservation_min_years));
                assertEquals(1, gr.multiplier());
                assertEquals(0, gr.cuts());
        }

        @Test
        @DisplayName("Cuts stop at the floor")
        void floor()
        {
                Guardrails gr = new Guardrails(config, 0.04);
                for (int i = 0; i < 20; i++)
                        gr.update(80000, 1000000, 30);
                assertEquals(config.guardrail_floor, gr.multiplier(), 1e-12);
                assertEquals(7, gr.cuts());
        }

        @Test
        @DisplayName("Crossing the lower guardrail raises spending up to the ceiling")
        void lowerGuardrailRaises()
        {
                Guardrails gr = new Guardrails(config, 0.04);
                assertSame(SpendingState.PROSPERITY, gr.update(20000, 1000000, 30));
                assertEquals(1.1, gr.multiplier(), 1e-12);
                for (int i = 0; i < 20; i++)
                        gr.update(20000, 1000000, 30);
                assertEquals(config.guardrail_ceiling, gr.multiplier(), 1e-12);
                assertEquals(5, gr.raises());
        }

        @Test
        @DisplayName("Nothing changes when nothing is withdrawn")
        void noWithdrawal()
        {
                Guardrails gr = new Guardrails(config, 0.04);
                assertSame(SpendingState.NORMAL, gr.update(0, 1000000, 30));
                assertSame(SpendingState.NORMAL, gr.update(10000, 0, 30));
                assertEquals(1, gr.multiplier());
        }
}
