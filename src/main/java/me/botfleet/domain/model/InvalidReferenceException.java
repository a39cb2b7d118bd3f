/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.botfleet.domain.model;

/**
 * Configuration error: a template, credential or personality reference that
 * does not exist or cannot be used.
 */
public class InvalidReferenceException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String referenceType;
    private final String reference;

    public InvalidReferenceException(String referenceType, String reference, String message) {
        super(message);
        this.referenceType = referenceType;
        this.reference = reference;
    }

    public static InvalidReferenceException unknown(String referenceType, String reference) {
        return new InvalidReferenceException(referenceType, reference,
                "Unknown " + referenceType + " '" + reference + "'");
    }

    public String getReferenceType() {
        return referenceType;
    }

    public String getReference() {
        return reference;
    }
}
