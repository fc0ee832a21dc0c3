/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2020-2030 The XdagJ Developers
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.slotsync;

import java.util.HashMap;
import java.util.Map;

public enum Network {

    MAINNET("mainnet"),

    TESTNET("testnet"),

    DEVNET("devnet");

    private static final Map<String, Network> labels = new HashMap<>();

    static {
        for (Network net : Network.values()) {
            labels.put(net.label, net);
        }
    }

    private final String label;

    Network(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @return the network with the given label, or null if there is none
     */
    public static Network of(String label) {
        return labels.get(label);
    }

    @Override
    public String toString() {
        return label;
    }
}
