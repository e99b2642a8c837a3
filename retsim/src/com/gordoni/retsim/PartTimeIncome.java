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

/**
 * Part time work in retirement, paid from the retirement age until the phase out age.
 */
public class PartTimeIncome extends IncomeSource
{
        public final double annual; // Annual earnings in today's dollars.
        public final int end_age; // First age at which no part time income is earned.

        public PartTimeIncome(double annual, int end_age)
        {
                this.annual = annual;
                this.end_age = end_age;
        }

        public Kind kind()
        {
                return Kind.PART_TIME;
        }

        public double benefit(Person owner, int year, SimulationParameters params)
        {
                int age = owner.age + year;
                if (age < owner.retirement_age || age >= end_age)
                        return 0;
                return annual * Math.pow(1 + params.general_inflation, year);
        }
}
