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

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Period life tables and the sampling of death ages from them.
 */
public class VitalStats
{
	// Male and female probability of dying during a given year of age.
	// Social Security Administration: Period Life Table, 2021. Ages 50-120.
	//
	// (Source: https://www.ssa.gov/oact/STATS/table4c6.html )

	private static final int SSA_BASE_AGE = 50;
	private static final double ssa_male[] = { //
			0.004186, 0.004530, 0.004912, 0.005346, 0.005838, 0.006390, 0.006993, 0.007646, 0.008359, 0.009147,//
			0.010028, 0.010998, 0.012047, 0.013168, 0.014366, 0.015651, 0.017030, 0.018506, 0.020088, 0.021791,//
			0.023640, 0.025660, 0.027872, 0.030275, 0.032884, 0.035746, 0.038921, 0.042465, 0.046414, 0.050799,//
			0.055651, 0.061000, 0.066875, 0.073305, 0.080319, 0.087945, 0.096211, 0.105145, 0.114772, 0.125116,//
			0.136200, 0.148046, 0.160674, 0.174102, 0.188348, 0.203426, 0.219352, 0.236136, 0.253789, 0.272320,//
			0.291735, 0.312043, 0.333249, 0.355359, 0.378378, 0.402310, 0.427159, 0.452928, 0.479619, 0.507236,//
			0.535782, 0.565256, 0.595662, 0.627001, 0.659274, 0.692482, 0.726625, 0.761705, 0.797720, 0.834672,//
			1.000000,//
	};
	private static final double ssa_female[] = { //
			0.002634, 0.002838, 0.003071, 0.003344, 0.003658, 0.004005, 0.004379, 0.004780, 0.005217, 0.005710,//
			0.006283, 0.006920, 0.007610, 0.008351, 0.009154, 0.010035, 0.010998, 0.012049, 0.013201, 0.014477,//
			0.015901, 0.017483, 0.019230, 0.021139, 0.023216, 0.025490, 0.027998, 0.030774, 0.033834, 0.037189,//
			0.040853, 0.044842, 0.049174, 0.053870, 0.058954, 0.064449, 0.070379, 0.076770, 0.083647, 0.091037,//
			0.098966, 0.107461, 0.116549, 0.126257, 0.136613, 0.147644, 0.159378, 0.171842, 0.185064, 0.199071,//
			0.213890, 0.229548, 0.246073, 0.263492, 0.281832, 0.301122, 0.321389, 0.342661, 0.364966, 0.388332,//
			0.412788, 0.438361, 0.465082, 0.492978, 0.522080, 0.552418, 0.584022, 0.616923, 0.651152, 0.686741,//
			1.000000,//
	};

	// National Vital Statistics Reports: United States Life Tables, 2007. Ages 0-109.
	//
	// (Source: http://www.cdc.gov/nchs/products/life_tables.htm )

	private static final double cdc_male[] = { //
	                0.007390, 0.000490, 0.000316, 0.000242, 0.000201, 0.000182, 0.000170, 0.000156, 0.000134, 0.000107,//
			0.000085, 0.000089, 0.000143, 0.000256, 0.000411, 0.000573, 0.000725, 0.000873, 0.001014, 0.001149,//
			0.001292, 0.001427, 0.001512, 0.001529, 0.001497, 0.001448, 0.001409, 0.001382, 0.001376, 0.001390,//
			0.001412, 0.001437, 0.001474, 0.001516, 0.001570, 0.001634, 0.001716, 0.001821, 0.001956, 0.002120,//
			0.002303, 0.002505, 0.002735, 0.002992, 0.003270, 0.003556, 0.003855, 0.004187, 0.004570, 0.005001,//
			0.005474, 0.005969, 0.006473, 0.006971, 0.007469, 0.007995, 0.008567, 0.009179, 0.009843, 0.010571,//
			0.011378, 0.012264, 0.013227, 0.014275, 0.015434, 0.016771, 0.018156, 0.019682, 0.021327, 0.023144,//
			0.025204, 0.027616, 0.030417, 0.033598, 0.037153, 0.041097, 0.045315, 0.049944, 0.055019, 0.060576,//
			0.066655, 0.073296, 0.080542, 0.088435, 0.097021, 0.106343, 0.116446, 0.127371, 0.139160, 0.151850,//
			0.165475, 0.180063, 0.195635, 0.212205, 0.229779, 0.248348, 0.267897, 0.288394, 0.309795, 0.332043,//
			0.332043, 0.332043, 0.332043, 0.332043, 0.332043, 0.332043, 0.332043, 0.332043, 0.332043, 0.332043,// 100-109 conservatively extrapolated
	};
	private static final double cdc_female[] = { //
                	0.006103, 0.000430, 0.000255, 0.000193, 0.000149, 0.000145, 0.000132, 0.000122, 0.000112, 0.000103,//
			0.000096, 0.000100, 0.000120, 0.000160, 0.000212, 0.000271, 0.000325, 0.000369, 0.000400, 0.000422,//
			0.000443, 0.000467, 0.000488, 0.000504, 0.000518, 0.000532, 0.000548, 0.000565, 0.000583, 0.000605,//
			0.000634, 0.000670, 0.000714, 0.000767, 0.000824, 0.000887, 0.000959, 0.001040, 0.001137, 0.001248,//
			0.001367, 0.001495, 0.001644, 0.001812, 0.001994, 0.002182, 0.002373, 0.002569, 0.002775, 0.002995,//
			0.003236, 0.003494, 0.003763, 0.004041, 0.004330, 0.004639, 0.004981, 0.005372, 0.005826, 0.006347,//
			0.006942, 0.007595, 0.008293, 0.009029, 0.009826, 0.010753, 0.011692, 0.012722, 0.013830, 0.015062,//
			0.016484, 0.018170, 0.020151, 0.022445, 0.025056, 0.028016, 0.031215, 0.034767, 0.038707, 0.043073,//
			0.047907, 0.053254, 0.059160, 0.065676, 0.072854, 0.080749, 0.089416, 0.098914, 0.109300, 0.120630,//
			0.132959, 0.146339, 0.160816, 0.176428, 0.193208, 0.211174, 0.230333, 0.250679, 0.272186, 0.294812,//
			0.294812, 0.294812, 0.294812, 0.294812, 0.294812, 0.294812, 0.294812, 0.294812, 0.294812, 0.294812,// 100-109 conservatively extrapolated
	};

        public final String table;
        private final int base_age;
        private final double[] male;
        private final double[] female;

        public VitalStats(String table)
        {
                this.table = table;
                if ("ssa-2021".equals(table))
                {
                        base_age = SSA_BASE_AGE;
                        male = ssa_male;
                        female = ssa_female;
                }
                else if ("cdc-2007".equals(table))
                {
                        base_age = 0;
                        male = cdc_male;
                        female = cdc_female;
                }
                else
                        throw new IllegalArgumentException("Unknown life table: " + table);
        }

        public static boolean known_table(String table)
        {
                return "ssa-2021".equals(table) || "cdc-2007".equals(table);
        }

        public int min_age()
        {
                return base_age;
        }

        public int max_age()
        {
                return base_age + male.length - 1;
        }

        /**
         * Probability of dying during the year of age age. Ages outside the table use the nearest table age. Death is
         * certain at the table's final age.
         */
        public double hazard(Gender gender, HealthStatus health, int age)
        {
                if (age >= max_age())
                        return 1.0;
                int idx = Math.max(age, base_age) - base_age;
                double q = (gender == Gender.FEMALE ? female : male)[idx];
                return Math.min(1.0, q * health.mortality_multiplier);
        }

        /**
         * Probability person is alive years years after the start of the simulation.
         */
        public double survival(Person person, int years)
        {
                double alive = 1;
                for (int y = 0; y < years; y++)
                        alive *= 1 - hazard(person.gender, person.health, person.age + y);
                return alive;
        }

        public double life_expectancy(Person person)
        {
                if (person.age > max_age())
                        return person.age;
                double alive = 1;
                double le = 0;
                for (int age = person.age; age <= max_age(); age++)
                {
                        double next = alive * (1 - hazard(person.gender, person.health, age));
                        le += (alive + next) / 2; // Deaths occur on average mid year.
                        alive = next;
                }
                return person.age + le;
        }

        /**
         * Sample the age at which person is first no longer alive.
         *
         * A single uniform longevity draw is compared against the survival curve, so a longer lived draw is longer
         * lived at every age.
         */
        public int sample_death_age(Person person, RandomGenerator random)
        {
                double longevity = random.nextDouble();
                if (person.age > max_age())
                        return person.age;
                double alive = 1;
                for (int age = person.age; ; age++)
                {
                        alive *= 1 - hazard(person.gender, person.health, age);
                        if (longevity >= alive)
                                return age + 1;
                }
        }

        /**
         * Death age used when mortality is not sampled.
         */
        public int fixed_death_age(Person person)
        {
                double le = person.life_expectancy != null ? person.life_expectancy : Math.round(life_expectancy(person));
                return (int) Math.min(le, max_age() + 1);
        }
}
