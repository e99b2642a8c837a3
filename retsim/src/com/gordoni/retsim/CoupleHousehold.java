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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class CoupleHousehold extends Household
{
        private final List<Person> people;

        public CoupleHousehold(Person primary, Person spouse)
        {
                people = Collections.unmodifiableList(Arrays.asList(primary, spouse));
        }

        public Person spouse()
        {
                return people.get(1);
        }

        public List<Person> people()
        {
                return people;
        }

        public boolean is_couple()
        {
                return true;
        }

        // A surviving spouse files single from the year after the death.
        public FilingStatus filing_status(boolean[] alive)
        {
                return alive[0] && alive[1] ? FilingStatus.MARRIED : FilingStatus.SINGLE;
        }
}
