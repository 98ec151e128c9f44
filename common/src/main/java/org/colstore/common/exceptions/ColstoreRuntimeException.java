/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.colstore.common.exceptions;

/**
 * Base unchecked exception of the colstore code base.
 */
public class ColstoreRuntimeException extends RuntimeException {
  private static final long serialVersionUID = -3796081521525479249L;

  public ColstoreRuntimeException() {
    super();
  }

  public ColstoreRuntimeException(String message, Throwable cause) {
    super(message, cause);
  }

  public ColstoreRuntimeException(String message) {
    super(message);
  }

  public ColstoreRuntimeException(Throwable cause) {
    super(cause);
  }

  public static ColstoreRuntimeException format(String format, Object... args) {
    return format(null, format, args);
  }

  public static ColstoreRuntimeException format(Throwable cause, String format, Object... args) {
    return new ColstoreRuntimeException(String.format(format, args), cause);
  }
}
