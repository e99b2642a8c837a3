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

import java.util.List;

/**
 * Guaranteed income and spending need for each simulated year.
 *
 * Year 0 is the first simulated year. Amounts are nominal: baseline expenses inflate at the general rate from the
 * start of the simulation, healthcare at its own rate.
 */
public class CashFlowProjector
{
        private final SimulationParameters params;
        private final List<Person> people;
        private final boolean couple;

        public CashFlowProjector(SimulationParameters params)
        {
                this.params = params;
                this.people = params.household.people();
                this.couple = params.household.is_couple();
        }

        public boolean[] alive(int year, int[] death_ages)
        {
                boolean[] alive = new boolean[people.size()];
                for (int i = 0; i < alive.length; i++)
                        alive[i] = people.get(i).alive(year, death_ages[i]);
                return alive;
        }

        private boolean widowed(boolean[] alive)
        {
                return couple && (alive[0] != alive[1]);
        }

        public IncomeBreakdown income(int year, boolean[] alive)
        {
                double[] ss = new double[people.size()];
                double pension = 0;
                double part_time = 0;
                boolean widowed = widowed(alive);
                for (int i = 0; i < people.size(); i++)
                {
                        Person p = people.get(i);
                        for (IncomeSource s : p.income)
                        {
                                double amount;
                                if (alive[i])
                                        amount = s.benefit(p, year, params);
                                else if (widowed)
                                        amount = s.survivor_benefit(p, year, params);
                                else
                                        amount = 0;
                                switch (s.kind())
                                {
                                case SOCIAL_SECURITY:
                                        ss[i] += amount;
                                        break;
                                case PENSION:
                                        pension += amount;
                                        break;
                                case PART_TIME:
                                        part_time += amount;
                                        break;
                                default:
                                        assert(false);
                                }
                        }
                }
                double social_security;
                if (widowed)
                        social_security = Math.max(ss[0], ss[1]);
                else
                        social_security = Utils.sum(ss);
                return new IncomeBreakdown(social_security, pension, part_time);
        }

        /**
         * Baseline spending need.
         *
         * @param discretionary_multiplier guardrail scaling of the discretionary budget
         */
        public ExpenseBreakdown expenses(int year, boolean[] alive, double discretionary_multiplier, double ltc, double irmaa)
        {
                double general = Math.pow(1 + params.general_inflation, year);
                double health = Math.pow(1 + params.healthcare_inflation, year);
                double survivor = widowed(alive) ? params.survivor_expense_fraction : 1;
                double survivor_health = widowed(alive) ? 0.5 : 1;
                return new ExpenseBreakdown(
                        params.essential_expenses * general * survivor,
                        params.discretionary_expenses * discretionary_multiplier * general * survivor,
                        params.healthcare_expenses * health * survivor_health,
                        ltc, irmaa);
        }

        public double ltc_cost(int year, LtcEpisode[] episodes, int[] death_ages)
        {
                double cost = 0;
                for (int i = 0; i < people.size(); i++)
                        if (episodes[i] != null)
                                cost += episodes[i].cost(year, people.get(i).age + year, death_ages[i], params.ltc);
                return cost;
        }

        public FilingStatus filing_status(boolean[] alive)
        {
                return params.household.filing_status(alive);
        }

        /**
         * Number of living people eligible for Medicare.
         */
        public int medicare_enrollees(int year, boolean[] alive)
        {
                int n = 0;
                for (int i = 0; i < people.size(); i++)
                        if (alive[i] && people.get(i).age + year >= 65)
                                n++;
                return n;
        }

        /**
         * Age used for required minimum distributions: that of the oldest living person.
         */
        public int rmd_age(int year, boolean[] alive)
        {
                int age = Integer.MIN_VALUE;
                for (int i = 0; i < people.size(); i++)
                        if (alive[i])
                                age = Math.max(age, people.get(i).age + year);
                return age;
        }
}
