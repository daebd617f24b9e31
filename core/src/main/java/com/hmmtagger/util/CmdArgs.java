/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.hmmtagger.util;

import java.util.Map;
import java.util.Map.Entry;
import java.util.Properties;

/**
 * Stores command line options in a map. The tools accept exactly one positional argument, so
 * options are passed as system properties with the {@link #SYSTEM_PROPERTY_PREFIX}, e.g.
 * -Dhmmtagger.prediction.threads=4
 *
 * @author Peter Karich
 */
public class CmdArgs extends PMap {
    public static final String SYSTEM_PROPERTY_PREFIX = "hmmtagger.";

    public CmdArgs() {
    }

    public CmdArgs(Map<String, String> map) {
        super(map);
    }

    public static CmdArgs readFromSystemProperties() {
        return readFromProperties(System.getProperties());
    }

    static CmdArgs readFromProperties(Properties properties) {
        CmdArgs cmdArgs = new CmdArgs();
        for (Entry<Object, Object> e : properties.entrySet()) {
            String k = ((String) e.getKey());
            String v = ((String) e.getValue());
            if (k.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                k = k.substring(SYSTEM_PROPERTY_PREFIX.length());
                cmdArgs.put(k, v);
            }
        }
        return cmdArgs;
    }

    @Override
    public CmdArgs put(String key, Object str) {
        super.put(key, str);
        return this;
    }
}
