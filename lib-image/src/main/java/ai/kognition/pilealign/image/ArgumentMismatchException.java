/*
 * Copyright 2022 Jim Carroll
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

package ai.kognition.pilealign.image;

/**
 * Thrown when arguments are inconsistent with each other or too few to work with, for example
 * point sets of different lengths.
 */
public class ArgumentMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public ArgumentMismatchException() {}

    public ArgumentMismatchException(final String msg) {
        super(msg);
    }

    public ArgumentMismatchException(final String msg, final Throwable th) {
        super(msg, th);
    }
}
