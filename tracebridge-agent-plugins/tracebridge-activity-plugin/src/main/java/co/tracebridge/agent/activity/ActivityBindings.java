/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.tracebridge.agent.activity;

import co.tracebridge.agent.impl.scope.Scope;
import co.tracebridge.agent.impl.transaction.AbstractSpan;

import javax.annotation.Nullable;

/**
 * Attaches agent state to {@link Activity activities}.
 */
public final class ActivityBindings {

    static final String SPAN_KEY = "co.tracebridge.span";
    static final String SCOPE_KEY = "co.tracebridge.scope";
    static final String EXCEPTION_KEY = "co.tracebridge.exception";

    private ActivityBindings() {
    }

    public static void bindSpan(Activity activity, AbstractSpan<?> span) {
        activity.setCustomProperty(SPAN_KEY, span);
    }

    /**
     * @return the span or transaction which has been created for the activity
     */
    @Nullable
    public static AbstractSpan<?> getSpan(Activity activity) {
        Object span = activity.getCustomProperty(SPAN_KEY);
        return span instanceof AbstractSpan ? (AbstractSpan<?>) span : null;
    }

    /**
     * Saves the scope of a request. Middleware which pops its scope before the activity ends has to save it,
     * so that the scope can be restored while the activity is finished.
     */
    public static void saveScope(Activity activity, Scope scope) {
        activity.setCustomProperty(SCOPE_KEY, scope);
    }

    /**
     * Walks the activity and its parents and returns the first saved scope.
     */
    @Nullable
    public static Scope findSavedScope(@Nullable Activity activity) {
        while (activity != null) {
            Object scope = activity.getCustomProperty(SCOPE_KEY);
            if (scope instanceof Scope) {
                return (Scope) scope;
            }
            activity = activity.getParent();
        }
        return null;
    }

    /**
     * Records an exception which ends the activity, the corresponding span will be finished with it.
     */
    public static void setException(Activity activity, Throwable exception) {
        activity.setCustomProperty(EXCEPTION_KEY, exception);
    }

    @Nullable
    public static Throwable getException(Activity activity) {
        Object exception = activity.getCustomProperty(EXCEPTION_KEY);
        return exception instanceof Throwable ? (Throwable) exception : null;
    }
}
