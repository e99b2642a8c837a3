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
 * The people whose lifetimes the plan must fund.
 */
public abstract class Household
{
        public abstract List<Person> people();

        public abstract boolean is_couple();

        public Person primary()
        {
                return people().get(0);
        }

        /**
         * Filing status for a year given which people are still alive.
         */
        public abstract FilingStatus filing_status(boolean[] alive);
}
