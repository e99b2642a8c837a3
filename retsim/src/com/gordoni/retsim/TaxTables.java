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
 * Federal tax, Medicare premium and required minimum distribution tables for one calendar year.
 *
 * Arrays indexed by filing status are ordered SINGLE, MARRIED.
 */
public class TaxTables
{
        public static final double[] ORDINARY_RATES = {0.10, 0.12, 0.22, 0.24, 0.32, 0.35, 0.37};
        public static final double CG_RATE_MID = 0.15;
        public static final double CG_RATE_HIGH = 0.20;
        public static final double NIIT_RATE = 0.038;

        // Not indexed for inflation.
        private static final double[][] SS_THRESHOLDS = {{25000, 34000}, {32000, 44000}};
        private static final double[] NIIT_THRESHOLD = {200000, 250000};

        // IRS Uniform Lifetime Table, ages 72-120.
        private static final int RMD_BASE_AGE = 72;
        private static final double[] RMD_FACTORS = {
                27.4, 26.5, 25.5, 24.6, 23.7, 22.9, 22.0, 21.1, 20.2, // 72-80
                19.4, 18.5, 17.7, 16.8, 16.0, 15.2, 14.4, 13.7, 12.9, 12.2, // 81-90
                11.5, 10.8, 10.1, 9.5, 8.9, 8.4, 7.8, 7.3, 6.8, 6.4, // 91-100
                6.0, 5.6, 5.2, 4.9, 4.6, 4.3, 4.1, 3.9, 3.7, 3.5, // 101-110
                3.4, 3.3, 3.1, 3.0, 2.9, 2.8, 2.7, 2.5, 2.3, 2.0, // 111-120
        };

        private static final TaxTables TABLES_2024 = new TaxTables(2024,
                new double[] {14600, 29200},
                new double[][] {{11600, 47150, 100525, 191950, 243725, 609350}, {23200, 94300, 201050, 383900, 487450, 731200}},
                new double[][] {{47025, 518900}, {94050, 583750}},
                new double[][] {{103000, 129000, 161000, 193000, 500000}, {206000, 258000, 322000, 386000, 750000}},
                new double[] {174.70, 244.60, 349.40, 454.20, 559.00, 594.00},
                new double[] {0, 12.90, 33.30, 53.80, 74.20, 81.00});

        private static final TaxTables TABLES_2025 = new TaxTables(2025,
                new double[] {15050, 30100},
                new double[][] {{11950, 48575, 103550, 197700, 251050, 627650}, {23900, 97150, 207100, 395400, 502100, 753150}},
                new double[][] {{48450, 534450}, {96900, 601250}},
                new double[][] {{106000, 133000, 166000, 199000, 515000}, {212000, 266000, 332000, 398000, 773000}},
                new double[] {185.00, 259.00, 370.00, 481.00, 592.00, 629.00},
                new double[] {0, 13.30, 34.30, 55.40, 76.40, 83.40});

        public final int year;
        private final double[] standard_deduction;
        private final double[][] bracket_tops; // Upper limit of each ordinary bracket but the last.
        private final double[][] cg_tops; // Top of the 0% and 15% capital gains brackets.
        private final double[][] irmaa_tops; // MAGI upper limit of each IRMAA tier but the last.
        private final double[] part_b; // Monthly Part B premium by tier.
        private final double[] part_d; // Monthly Part D surcharge by tier.

        private TaxTables(int year, double[] standard_deduction, double[][] bracket_tops, double[][] cg_tops, double[][] irmaa_tops, double[] part_b, double[] part_d)
        {
                this.year = year;
                this.standard_deduction = standard_deduction;
                this.bracket_tops = bracket_tops;
                this.cg_tops = cg_tops;
                this.irmaa_tops = irmaa_tops;
                this.part_b = part_b;
                this.part_d = part_d;
        }

        private static double[] scale(double[] a, double f)
        {
                double[] r = new double[a.length];
                for (int i = 0; i < a.length; i++)
                        r[i] = a[i] * f;
                return r;
        }

        private static double[][] scale(double[][] a, double f)
        {
                double[][] r = new double[a.length][];
                for (int i = 0; i < a.length; i++)
                        r[i] = scale(a[i], f);
                return r;
        }

        private TaxTables indexed(int new_year, double f)
        {
                return new TaxTables(new_year, scale(standard_deduction, f), scale(bracket_tops, f), scale(cg_tops, f), scale(irmaa_tops, f), scale(part_b, f), scale(part_d, f));
        }

        /**
         * Tables for calendar year year. Years after the latest published tables index it by inflation; earlier years
         * use the earliest published tables.
         */
        public static TaxTables for_year(int year, double inflation)
        {
                if (year <= TABLES_2024.year)
                        return TABLES_2024;
                else if (year == TABLES_2025.year)
                        return TABLES_2025;
                else
                        return TABLES_2025.indexed(year, Math.pow(1 + inflation, year - TABLES_2025.year));
        }

        public double standard_deduction(FilingStatus status)
        {
                return standard_deduction[status.ordinal()];
        }

        public double ordinary_tax(double taxable, FilingStatus status)
        {
                double[] tops = bracket_tops[status.ordinal()];
                double tax = 0;
                double bottom = 0;
                for (int i = 0; i < ORDINARY_RATES.length; i++)
                {
                        double top = i < tops.length ? tops[i] : Double.POSITIVE_INFINITY;
                        if (taxable <= bottom)
                                break;
                        tax += (Math.min(taxable, top) - bottom) * ORDINARY_RATES[i];
                        bottom = top;
                }
                return tax;
        }

        /**
         * Tax on taxable_gains stacked on top of taxable_ordinary income.
         */
        public double capital_gains_tax(double taxable_ordinary, double taxable_gains, FilingStatus status)
        {
                double zero_top = cg_tops[status.ordinal()][0];
                double mid_top = cg_tops[status.ordinal()][1];
                double lo = taxable_ordinary;
                double hi = taxable_ordinary + taxable_gains;
                double mid = Math.max(0, Math.min(hi, mid_top) - Math.max(lo, zero_top));
                double high = Math.max(0, hi - Math.max(lo, mid_top));
                return mid * CG_RATE_MID + high * CG_RATE_HIGH;
        }

        public double ss_threshold(FilingStatus status, int which)
        {
                return SS_THRESHOLDS[status.ordinal()][which];
        }

        public double niit_threshold(FilingStatus status)
        {
                return NIIT_THRESHOLD[status.ordinal()];
        }

        /**
         * Annual IRMAA surcharge for one Medicare enrollee: the excess of the tier's Part B premium over the base
         * premium plus the tier's Part D addition.
         */
        public double irmaa_surcharge(double magi, FilingStatus status)
        {
                double[] tops = irmaa_tops[status.ordinal()];
                int tier = 0;
                while (tier < tops.length && magi > tops[tier])
                        tier++;
                return 12 * (part_b[tier] - part_b[0] + part_d[tier]);
        }

        public static double rmd_factor(int age)
        {
                if (age < RMD_BASE_AGE)
                        return Double.POSITIVE_INFINITY;
                int idx = Math.min(age - RMD_BASE_AGE, RMD_FACTORS.length - 1);
                return RMD_FACTORS[idx];
        }
}
