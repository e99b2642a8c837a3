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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Person
{
        public final int age;
        public final int retirement_age;
        public final Gender gender;
        public final HealthStatus health;
        public final Integer life_expectancy; // Fixed final age when mortality is not sampled, or null to use the life table.
        public final List<IncomeSource> income;

        public Person(int age, int retirement_age, Gender gender, HealthStatus health, Integer life_expectancy, List<IncomeSource> income)
        {
                this.age = age;
                this.retirement_age = retirement_age;
                this.gender = gender;
                this.health = health;
                this.life_expectancy = life_expectancy;
                this.income = Collections.unmodifiableList(new ArrayList<IncomeSource>(income));
        }

        public boolean alive(int year, int death_age)
        {
                return age + year < death_age;
        }
}
