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

public class Pension extends IncomeSource
{
        public final double annual; // Annual payment in dollars at the start of the simulation.
        public final double cola; // Annual cost of living adjustment.
        public final double survivor_fraction; // Fraction paid to the surviving spouse.

        public Pension(double annual, double cola, double survivor_fraction)
        {
                this.annual = annual;
                this.cola = cola;
                this.survivor_fraction = survivor_fraction;
        }

        public Kind kind()
        {
                return Kind.PENSION;
        }

        public double benefit(Person owner, int year, SimulationParameters params)
        {
                if (owner.age + year < owner.retirement_age)
                        return 0;
                return annual * Math.pow(1 + cola, year);
        }

        @Override
        public double survivor_benefit(Person owner, int year, SimulationParameters params)
        {
                return survivor_fraction * benefit(owner, year, params);
        }
}
