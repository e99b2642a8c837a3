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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IncomeProjectorTest
{
        @Test
        @DisplayName("Claiming early reduces and delaying increases Social Security")
        void claimAdjustment()
        {
                assertEquals(0.70, SocialSecurity.claim_adjustment(62, 67), 1e-9);
                assertEquals(1.0, SocialSecurity.claim_adjustment(67, 67), 1e-9);
                assertEquals(1.24, SocialSecurity.claim_adjustment(70, 67), 1e-9);
                assertEquals(1.24, SocialSecurity.claim_adjustment(75, 67), 1e-9);
                assertEquals(1 - 24 * 5.0 / 900, SocialSecurity.claim_adjustment(65, 67), 1e-9);
        }

        @Test
        @DisplayName("Delaying the claim never lowers the benefit once claimed")
        void delayingClaimNeverLowersBenefit()
        {
                double previous = 0;
                for (int claim = 62; claim <= 70; claim++)
                {
                        Person p = Fixtures.person(62, Gender.FEMALE, new SocialSecurity(24000, claim, 67));
                        SimulationParameters params = Fixtures.builder(new SingleHousehold(p)).build();
                        double benefit = new CashFlowProjector(params).income(claim - 62, new boolean[] {true}).social_security / Math.pow(1 + params.ss_cola, claim - 62);
                        assertTrue(benefit >= previous);
                        previous = benefit;
                }
        }

        @Test
        @DisplayName("Social Security starts at the claiming age and grows with the cost of living adjustment")
        void socialSecurityTiming()
        {
                Person p = Fixtures.person(65, Gender.MALE, new SocialSecurity(30000, 67, 67));
                SimulationParameters params = Fixtures.builder(new SingleHousehold(p)).ss_cola(0.02).build();
                CashFlowProjector projector = new CashFlowProjector(params);
                boolean[] alive = {true};
                assertEquals(0, projector.income(0, alive).social_security);
                assertEquals(0, projector.income(1, alive).social_security);
                assertEquals(30000 * Math.pow(1.02, 2), projector.income(2, alive).social_security, 1e-6);
        }

        @Test
        @DisplayName("A surviving spouse keeps the larger Social Security benefit and the pension survivor share")
        void survivorBenefits()
        {
                Person primary = Fixtures.person(70, Gender.MALE, new SocialSecurity(30000, 67, 67), new Pension(20000, 0, 0.5));
                Person spouse = Fixtures.person(70, Gender.FEMALE, new SocialSecurity(12000, 67, 67));
                SimulationParameters params = Fixtures.builder(new CoupleHousehold(primary, spouse)).ss_cola(0).build();
                CashFlowProjector projector = new CashFlowProjector(params);

                IncomeBreakdown both = projector.income(0, new boolean[] {true, true});
                assertEquals(42000, both.social_security, 1e-6);
                assertEquals(20000, both.pension, 1e-6);

                IncomeBreakdown widow = projector.income(0, new boolean[] {false, true});
                assertEquals(30000, widow.social_security, 1e-6);
                assertEquals(10000, widow.pension, 1e-6);

                IncomeBreakdown none = projector.income(0, new boolean[] {false, false});
                assertEquals(0, none.total());
        }

        @Test
        @DisplayName("Part time income stops at its end age")
        void partTimeIncome()
        {
                Person p = Fixtures.person(65, Gender.FEMALE, new PartTimeIncome(20000, 68));
                SimulationParameters params = Fixtures.builder(new SingleHousehold(p)).general_inflation(0).build();
                CashFlowProjector projector = new CashFlowProjector(params);
                boolean[] alive = {true};
                assertEquals(20000, projector.income(2, alive).part_time, 1e-6);
                assertEquals(0, projector.income(3, alive).part_time);
        }

        @Test
        @DisplayName("Expenses inflate and shrink for a survivor")
        void expenses()
        {
                Person primary = Fixtures.person(66, Gender.MALE);
                Person spouse = Fixtures.person(64, Gender.FEMALE);
                SimulationParameters params = Fixtures.builder(new CoupleHousehold(primary, spouse))
                        .essential_expenses(40000).discretionary_expenses(20000).healthcare_expenses(10000)
                        .general_inflation(0.03).healthcare_inflation(0.05).survivor_expense_fraction(0.75).build();
                CashFlowProjector projector = new CashFlowProjector(params);

                ExpenseBreakdown both = projector.expenses(1, new boolean[] {true, true}, 0.5, 0, 0);
                assertEquals(40000 * 1.03, both.essential, 1e-6);
                assertEquals(10000 * 1.03, both.discretionary, 1e-6);
                assertEquals(10000 * 1.05, both.healthcare, 1e-6);

                ExpenseBreakdown widow = projector.expenses(0, new boolean[] {true, false}, 1, 100, 50);
                assertEquals(30000, widow.essential, 1e-6);
                assertEquals(15000, widow.discretionary, 1e-6);
                assertEquals(5000, widow.healthcare, 1e-6);
                assertEquals(30000 + 15000 + 5000 + 100 + 50, widow.total(), 1e-6);
        }

        @Test
        @DisplayName("Filing status, Medicare enrollment, and distribution age follow who is alive")
        void householdStatus()
        {
                Person primary = Fixtures.person(66, Gender.MALE);
                Person spouse = Fixtures.person(63, Gender.FEMALE);
                SimulationParameters params = Fixtures.builder(new CoupleHousehold(primary, spouse)).build();
                CashFlowProjector projector = new CashFlowProjector(params);

                assertArrayEquals(new boolean[] {true, false}, projector.alive(10, new int[] {90, 73}));
                assertSame(FilingStatus.MARRIED, projector.filing_status(new boolean[] {true, true}));
                assertSame(FilingStatus.SINGLE, projector.filing_status(new boolean[] {true, false}));
                assertEquals(1, projector.medicare_enrollees(0, new boolean[] {true, true}));
                assertEquals(2, projector.medicare_enrollees(2, new boolean[] {true, true}));
                assertEquals(76, projector.rmd_age(10, new boolean[] {true, true}));
                assertEquals(73, projector.rmd_age(10, new boolean[] {false, true}));
        }
}
