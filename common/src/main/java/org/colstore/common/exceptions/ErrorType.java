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
 * Kinds of {@link UserException}. The kind is rendered as the prefix of the
 * message shown to the caller.
 */
public enum ErrorType {
  /** Internal error, the message only points to the logs. */
  SYSTEM,
  /** Source data could not be read or decoded. */
  DATA_READ,
  /** Data could not be written to storage. */
  DATA_WRITE,
  /** Input text could not be parsed. */
  PARSE,
  /** Invalid configuration: unknown names, missing or malformed options. */
  VALIDATION,
  /** The request is well formed but asks for something that is not supported. */
  UNSUPPORTED_OPERATION
}
