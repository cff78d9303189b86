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
 * Extension point for adding checks to a health checker, on top of the standard categories.
 */
public interface CheckRegistry {
    /**
     * Adds a check to a synthetic category, appended after the standard categories. If a synthetic category with the
     * given id has already been added, the check is appended to it.
     */
    void addCheck(CategoryId category, String description, String hintAnchor, CheckBody body);

    /**
     * Adds a fully specified category after the standard categories, and after any categories added before it.
     */
    void addCategory(Category category);
}
