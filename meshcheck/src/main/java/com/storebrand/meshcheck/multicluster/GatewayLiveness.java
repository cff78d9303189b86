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


package com.storebrand.meshcheck.multicluster;

import java.util.ArrayList;
import java.util.List;

import com.storebrand.meshcheck.CheckOutcome;
import com.storebrand.meshcheck.ErrorMessages;
import com.storebrand.meshcheck.rpc.GatewayStatus;

/**
 * Turns gateway statuses from the public API into an outcome: no gateways is a skip, any dead gateway is a failure,
 * and otherwise a verbose success listing the live ones.
 */
public final class GatewayLiveness {
    static final String NO_GATEWAYS = "no target cluster gateways";

    private GatewayLiveness() {
        // Utility class - hiding constructor
    }

    public static CheckOutcome evaluate(List<GatewayStatus> gateways) {
        if (gateways == null || gateways.isEmpty()) {
            return CheckOutcome.skip(NO_GATEWAYS);
        }
        List<String> alive = new ArrayList<>();
        List<String> dead = new ArrayList<>();
        for (GatewayStatus gateway : gateways) {
            String line = "\t* cluster: [" + gateway.clusterName + "], gateway: [" + gateway.namespace + "/"
                    + gateway.name + "]";
            if (gateway.alive) {
                alive.add(line);
            }
            else {
                dead.add(line);
            }
        }
        if (!dead.isEmpty()) {
            return CheckOutcome.fail(ErrorMessages.joinUnder("Some gateways are not alive:", dead));
        }
        return CheckOutcome.okVerbose(String.join("\n", alive));
    }
}
