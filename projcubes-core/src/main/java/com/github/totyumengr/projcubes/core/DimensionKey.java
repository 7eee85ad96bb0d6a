/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.projcubes.core;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Grouping key of a bucket: one member per active dimension, in the order of dimensions of the owning
 * {@link CubeResult}.
 *
 * <p>Keys are ordered member by member with {@link #MEMBER_ORDER}: numbers numerically, then strings, then
 * {@link ReservedMember#UNKNOWN}, then {@link ReservedMember#ALL} and {@link ReservedMember#TOTAL}. This order is the
 * iteration order of every result.
 *
 * @author mengran
 *
 */
public final class DimensionKey implements Comparable<DimensionKey> {

    /**
     * Key of the only bucket when no dimension is active.
     */
    public static final DimensionKey EMPTY = new DimensionKey(new Object[0]);

    public static final Comparator<Object> MEMBER_ORDER = new Comparator<Object>() {

        @Override
        public int compare(Object o1, Object o2) {
            int r1 = rank(o1);
            int r2 = rank(o2);
            if (r1 != r2) {
                return r1 - r2;
            }
            if (r1 == 0) {
                return decimal(o1).compareTo(decimal(o2));
            }
            if (o1 instanceof ReservedMember) {
                return ((ReservedMember) o1).compareTo((ReservedMember) o2);
            }
            return o1.toString().compareTo(o2.toString());
        }

        private BigDecimal decimal(Object o) {
            return o instanceof BigDecimal ? (BigDecimal) o : BigDecimal.valueOf(((Number) o).longValue());
        }

        private int rank(Object o) {
            if (o instanceof Number) {
                return 0;
            }
            if (o == ReservedMember.UNKNOWN) {
                return 2;
            }
            if (o instanceof ReservedMember) {
                return 3;
            }
            return 1;
        }
    };

    private final Object[] members;

    private DimensionKey(Object[] members) {
        this.members = members;
    }

    /**
     * @param members already normalized members, see {@link FactTable#member(Object)}
     * @return new key
     */
    public static DimensionKey of(Object... members) {
        if (members.length == 0) {
            return EMPTY;
        }
        Object[] copy = new Object[members.length];
        for (int i = 0; i < members.length; i++) {
            copy[i] = FactTable.member(members[i]);
        }
        return new DimensionKey(copy);
    }

    static DimensionKey wrap(Object[] members) {
        return members.length == 0 ? EMPTY : new DimensionKey(members);
    }

    public int size() {
        return members.length;
    }

    public Object get(int index) {
        return members[index];
    }

    /**
     * @return <code>true</code> if any member is {@link ReservedMember#ALL}
     */
    public boolean isMargin() {
        for (Object m : members) {
            if (m == ReservedMember.ALL) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param index position to replace
     * @param member new member
     * @return copy with member at index replaced
     */
    public DimensionKey with(int index, Object member) {
        Object[] copy = members.clone();
        copy[index] = member;
        return new DimensionKey(copy);
    }

    /**
     * @param indexes positions to keep, in output order
     * @return key made of selected members
     */
    public DimensionKey project(int[] indexes) {
        Object[] projected = new Object[indexes.length];
        for (int i = 0; i < indexes.length; i++) {
            projected[i] = members[indexes[i]];
        }
        return wrap(projected);
    }

    @Override
    public int compareTo(DimensionKey o) {
        int len = Math.min(members.length, o.members.length);
        for (int i = 0; i < len; i++) {
            int c = MEMBER_ORDER.compare(members[i], o.members[i]);
            if (c != 0) {
                return c;
            }
        }
        return members.length - o.members.length;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DimensionKey)) {
            return false;
        }
        return Arrays.equals(members, ((DimensionKey) obj).members);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(members);
    }

    @Override
    public String toString() {
        return Arrays.toString(members);
    }

}
