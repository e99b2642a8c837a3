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
 * A guaranteed income stream belonging to one person.
 */
public abstract class IncomeSource
{
        public enum Kind
        {
                SOCIAL_SECURITY, PENSION, PART_TIME
        }

        public abstract Kind kind();

        /**
         * Nominal amount paid in simulation year year while the owner is alive.
         */
        public abstract double benefit(Person owner, int year, SimulationParameters params);

        /**
         * Nominal amount paid to the surviving spouse in simulation year year after the owner has died.
         */
        public double survivor_benefit(Person owner, int year, SimulationParameters params)
        {
                return 0;
        }
}
