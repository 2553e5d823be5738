// Copyright 2026 The Calor Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package calor.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public class Util {

    /**
     * Apply a rewrite to every element of a list. If no element is changed by
     * the rewrite (as determined by reference equality) then the original list
     * is returned, otherwise a fresh list is.
     *
     * @param items
     * @param fn
     * @param <T>
     * @return
     */
    public static <T> List<T> rewrite(List<T> items, Function<T,T> fn) {
        List<T> result = items;
        for (int i = 0; i != items.size(); ++i) {
            T o = items.get(i);
            T n = fn.apply(o);
            if (o != n) {
                if (result == items) {
                    result = new ArrayList<>(items);
                }
                result.set(i, n);
            }
        }
        return result;
    }

    /**
     * Check whether two lists hold exactly the same instances in the same order.
     *
     * @param left
     * @param right
     * @return
     */
    public static <T> boolean identical(List<T> left, List<T> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i != left.size(); ++i) {
            if (left.get(i) != right.get(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Functional list append.  This creates a fresh list containing both <code>left</code> and <code>right</code> operands.
     * @param left
     * @param right
     * @param <T>
     * @return
     */
    public static <T> List<T> append(List<T> left, T right) {
        ArrayList<T> result = new ArrayList<>();
        result.addAll(left);
        result.add(right);
        return result;
    }
}
