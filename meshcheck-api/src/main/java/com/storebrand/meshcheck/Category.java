/*
 * Copyright 2022 Storebrand ASA
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.storebrand.meshcheck;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered, named group of {@link Checker}s. Checkers run in the order they were added.
 */
public final class Category {
    private final CategoryId _id;
    private final List<Checker> _checkers;

    public Category(CategoryId id, List<Checker> checkers) {
        _id = Objects.requireNonNull(id, "id");
        _checkers = Collections.unmodifiableList(new ArrayList<>(checkers));
    }

    public static Category of(CategoryId id, Checker... checkers) {
        return new Category(id, Arrays.asList(checkers));
    }

    public CategoryId getId() {
        return _id;
    }

    public List<Checker> getCheckers() {
        return _checkers;
    }

    /**
     * @return a new category with the given checker appended.
     */
    public Category with(Checker checker) {
        List<Checker> checkers = new ArrayList<>(_checkers);
        checkers.add(checker);
        return new Category(_id, checkers);
    }

    @Override
    public String toString() {
        return "Category[" + _id + ", " + _checkers.size() + " checks]";
    }
}
