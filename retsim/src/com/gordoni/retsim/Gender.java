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

public enum Gender
{
        MALE, FEMALE;

        public static Gender parse(String s)
        {
                if ("male".equalsIgnoreCase(s) || "m".equalsIgnoreCase(s))
                        return MALE;
                else if ("female".equalsIgnoreCase(s) || "f".equalsIgnoreCase(s))
                        return FEMALE;
                else
                        throw new IllegalArgumentException("Unknown gender: " + s);
        }
}
