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

import java.util.List;

import com.storebrand.meshcheck.rpc.SelfCheckResult;

/**
 * A remote self-check body. It returns one {@link SelfCheckResult} per remote subsystem. An exception thrown from
 * {@link #call(CheckContext)} is a transport error: it is reported once and never retried.
 */
@FunctionalInterface
public interface SelfCheckBody {
    List<SelfCheckResult> call(CheckContext context) throws Exception;
}
