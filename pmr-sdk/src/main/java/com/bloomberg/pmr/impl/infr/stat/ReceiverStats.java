/*
 * Copyright 2023 Bloomberg Finance L.P.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.bloomberg.pmr.impl.infr.stat;

import static com.bloomberg.pmr.impl.infr.stat.StatsUtil.formatCenter;
import static com.bloomberg.pmr.impl.infr.stat.StatsUtil.formatNum;
import static com.bloomberg.pmr.impl.infr.stat.StatsUtil.repeatCharacter;

import com.bloomberg.pmr.MessageSettlementOutcome;
import com.bloomberg.pmr.impl.infr.util.Argument;

public class ReceiverStats {

    // Receiver statistics:
    //
    // : o !Received!: number of messages delivered by the broker
    // :
    // : o !Accepted!, !Failed!, !Rejected!: number of messages successfully
    // :   settled with the corresponding outcome
    // :
    // : o !Settle Err!: number of settle calls which failed
    // :
    // : o !Handler Err!: number of messages the user handler threw on
    // :
    // : o !Dropped!: number of buffered messages not passed to the handler
    // :   because the receiver was terminated
    // :
    // : o !Buffer Max!: maximum number of messages waiting for the handler

    private static final String[] HEADERS =
            new String[] {
                "Received",
                "Accepted",
                "Failed",
                "Rejected",
                "Settle Err",
                "Handler Err",
                "Dropped",
                "Buffer Max"
            };

    private long received;
    private long accepted;
    private long failed;
    private long rejected;
    private long settleFailures;
    private long handlerFailures;
    private long dropped;
    private long bufferSize;
    private long bufferMax;

    public synchronized void onReceive() {
        received++;
        bufferSize++;
        bufferMax = Math.max(bufferMax, bufferSize);
    }

    public synchronized void onDispatch() {
        if (bufferSize == 0) {
            throw new IllegalStateException("Buffer size is zero");
        }
        bufferSize--;
    }

    public synchronized void onSettle(MessageSettlementOutcome outcome) {
        Argument.expectNonNull(outcome, "outcome");
        switch (outcome) {
            case ACCEPTED:
                accepted++;
                break;
            case FAILED:
                failed++;
                break;
            case REJECTED:
                rejected++;
                break;
            default:
                throw new IllegalArgumentException("Unexpected outcome: " + outcome);
        }
    }

    public synchronized void onSettleFailure() {
        settleFailures++;
    }

    public synchronized void onHandlerFailure() {
        handlerFailures++;
    }

    public synchronized void onDrop(int count) {
        Argument.expectNonNegative(count, "count");
        dropped += count;
        bufferSize = Math.max(0, bufferSize - count);
    }

    public synchronized long received() {
        return received;
    }

    public synchronized long settled(MessageSettlementOutcome outcome) {
        Argument.expectNonNull(outcome, "outcome");
        switch (outcome) {
            case ACCEPTED:
                return accepted;
            case FAILED:
                return failed;
            case REJECTED:
                return rejected;
            default:
                throw new IllegalArgumentException("Unexpected outcome: " + outcome);
        }
    }

    public synchronized long settleFailures() {
        return settleFailures;
    }

    public synchronized long handlerFailures() {
        return handlerFailures;
    }

    public synchronized long dropped() {
        return dropped;
    }

    public synchronized long bufferMax() {
        return bufferMax;
    }

    public synchronized void dump(StringBuilder builder) {
        builder.append("::::: Receiver >>\n");

        long[] values =
                new long[] {
                    received,
                    accepted,
                    failed,
                    rejected,
                    settleFailures,
                    handlerFailures,
                    dropped,
                    bufferMax
                };

        // Determine columns widths
        int[] widths = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            widths[i] = Math.max(formatNum(values[i]).length(), HEADERS[i].length());
        }

        // Print headers
        for (int i = 0; i < widths.length; i++) {
            if (i > 0) {
                builder.append("| ");
            }
            builder.append(formatCenter(HEADERS[i], widths[i]));
        }
        builder.append("\n");

        repeatCharacter(builder, '-', widths[0]);
        for (int i = 1; i < widths.length; i++) {
            builder.append('+');
            repeatCharacter(builder, '-', widths[i] + 1);
        }
        builder.append("\n");

        // Print statistics
        for (int i = 0; i < widths.length; i++) {
            if (i > 0) {
                builder.append("| ");
            }
            builder.append(String.format("%" + widths[i] + "s", formatNum(values[i])));
        }
        builder.append("\n");
    }
}
