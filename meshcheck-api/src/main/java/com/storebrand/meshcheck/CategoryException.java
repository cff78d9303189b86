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

/**
 * Wraps a check failure together with the category it originated from, so callers can filter or group failures by
 * category.
 */
public class CategoryException extends RuntimeException {
    private final CategoryId _category;

    public CategoryException(CategoryId category, Throwable cause) {
        super(cause.getMessage(), cause);
        _category = category;
    }

    public CategoryId getCategory() {
        return _category;
    }

    /**
     * @return true if the given error is a {@link CategoryException} from the given category.
     */
    public static boolean isCategoryError(Throwable error, CategoryId category) {
        return error instanceof CategoryException
                && ((CategoryException) error).getCategory().equals(category);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + _category + "]: " + getMessage();
    }
}
