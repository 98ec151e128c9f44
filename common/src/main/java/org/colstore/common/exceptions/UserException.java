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

import org.slf4j.Logger;

/**
 * Base class for all user exceptions. The goal is to separate out common error conditions where we can give callers
 * useful feedback.
 * <p>Throwing a user exception guarantees its message will be displayed to the caller, along with any context
 * information added to the exception at various levels.
 * <p>A specific class of user exceptions are system exceptions. They represent system level errors that don't display
 * any specific error message apart from the root cause, along with an id to retrieve the details from the logs.
 *
 * @see ErrorType
 */
public class UserException extends ColstoreRuntimeException {
  private static final long serialVersionUID = -6720929331624621840L;

  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(UserException.class);

  /**
   * Wraps the passed exception inside a system error.
   * <p>The cause message will be used unless {@link Builder#message(String, Object...)} is called.
   * <p>If the wrapped exception is, or wraps, a user exception it will be returned by {@link Builder#build(Logger)}
   * instead of creating a new exception.
   *
   * Only meant for failures of unknown origin, see {@link ErrorHelper#wrap(Throwable)}.
   *
   * @param cause exception we want the user exception to wrap
   * @return user exception builder
   */
  public static Builder systemError(final Throwable cause) {
    return new Builder(ErrorType.SYSTEM, cause);
  }

  /**
   * Creates a new user exception builder.
   *
   * @see ErrorType#DATA_READ
   * @return user exception builder
   */
  public static Builder dataReadError() {
    return dataReadError(null);
  }

  /**
   * Wraps the passed exception inside a data read error.
   * <p>The cause message will be used unless {@link Builder#message(String, Object...)} is called.
   * <p>If the wrapped exception is, or wraps, a user exception it will be returned by {@link Builder#build(Logger)}
   * instead of creating a new exception. Any added context will be added to the user exception as well.
   *
   * @see ErrorType#DATA_READ
   *
   * @param cause exception we want the user exception to wrap. If cause is, or wrap, a user exception it will be
   *              returned by the builder instead of creating a new user exception
   * @return user exception builder
   */
  public static Builder dataReadError(final Throwable cause) {
    return new Builder(ErrorType.DATA_READ, cause);
  }

  /**
   * Creates a new user exception builder.
   *
   * @see ErrorType#DATA_WRITE
   * @return user exception builder
   */
  public static Builder dataWriteError() {
    return dataWriteError(null);
  }

  /**
   * Wraps the passed exception inside a data write error.
   *
   * @see ErrorType#DATA_WRITE
   *
   * @param cause exception we want the user exception to wrap
   * @return user exception builder
   */
  public static Builder dataWriteError(final Throwable cause) {
    return new Builder(ErrorType.DATA_WRITE, cause);
  }

  /**
   * Creates a new user exception builder.
   *
   * @see ErrorType#PARSE
   * @return user exception builder
   */
  public static Builder parseError() {
    return parseError(null);
  }

  /**
   * Wraps the passed exception inside a parse error.
   *
   * @see ErrorType#PARSE
   *
   * @param cause exception we want the user exception to wrap
   * @return user exception builder
   */
  public static Builder parseError(final Throwable cause) {
    return new Builder(ErrorType.PARSE, cause);
  }

  /**
   * Creates a new user exception builder.
   *
   * @see ErrorType#VALIDATION
   * @return user exception builder
   */
  public static Builder validationError() {
    return validationError(null);
  }

  /**
   * Wraps the passed exception inside a validation error.
   *
   * @see ErrorType#VALIDATION
   *
   * @param cause exception we want the user exception to wrap
   * @return user exception builder
   */
  public static Builder validationError(final Throwable cause) {
    return new Builder(ErrorType.VALIDATION, cause);
  }

  /**
   * Creates a new user exception builder.
   *
   * @see ErrorType#UNSUPPORTED_OPERATION
   * @return user exception builder
   */
  public static Builder unsupportedError() {
    return unsupportedError(null);
  }

  /**
   * Wraps the passed exception inside an unsupported operation error.
   *
   * @see ErrorType#UNSUPPORTED_OPERATION
   *
   * @param cause exception we want the user exception to wrap
   * @return user exception builder
   */
  public static Builder unsupportedError(final Throwable cause) {
    return new Builder(ErrorType.UNSUPPORTED_OPERATION, cause);
  }

  /**
   * Builder class for UserException. You can wrap an existing exception, in this case it will first check if
   * this exception is, or wraps, a UserException. If it does then the builder will use the user exception as it is
   * (it will ignore the message passed to the builder) and will add any additional context information to the
   * exception's context
   */
  public static class Builder {

    private final Throwable cause;
    private final ErrorType errorType;
    private final UserException uex;
    private final UserExceptionContext context;

    private String message;

    /**
     * Wraps an existing exception inside a user exception.
     *
     * @param errorType user exception type that should be created if the passed exception isn't,
     *                  or doesn't wrap a user exception
     * @param cause exception to wrap inside a user exception. Can be null
     */
    private Builder(final ErrorType errorType, final Throwable cause) {
      this.cause = cause;

      uex = ErrorHelper.findWrappedUserException(cause);
      if (uex != null) {
        this.errorType = null;
        this.context = uex.context;
      } else {
        // we will create a new user exception
        this.errorType = errorType;
        this.context = new UserExceptionContext();
        this.message = cause != null ? cause.getMessage() : null;
      }
    }

    /**
     * sets or replaces the error message.
     * <p>This will be ignored if this builder is wrapping a user exception
     *
     * @see String#format(String, Object...)
     *
     * @param format format string
     * @param args Arguments referenced by the format specifiers in the format string
     * @return this builder
     */
    public Builder message(final String format, final Object... args) {
      // we can't replace the message of a user exception
      if (uex == null && format != null) {
        this.message = args.length == 0 ? format : String.format(format, args);
      }
      return this;
    }

    /**
     * add a string line to the bottom of the context
     * @param value string line
     * @return this builder
     */
    public Builder addContext(final String value) {
      context.add(value);
      return this;
    }

    /**
     * add a string value to the bottom of the context
     *
     * @param name context name
     * @param value context value
     * @return this builder
     */
    public Builder addContext(final String name, final String value) {
      context.add(name, value);
      return this;
    }

    /**
     * add a long value to the bottom of the context
     *
     * @param name context name
     * @param value context value
     * @return this builder
     */
    public Builder addContext(final String name, final long value) {
      context.add(name, value);
      return this;
    }

    /**
     * pushes a string value to the top of the context
     *
     * @param value context value
     * @return this builder
     */
    public Builder pushContext(final String value) {
      context.push(value);
      return this;
    }

    /**
     * pushes a string value to the top of the context
     *
     * @param name context name
     * @param value context value
     * @return this builder
     */
    public Builder pushContext(final String name, final String value) {
      context.push(name, value);
      return this;
    }

    /**
     * builds a user exception or returns the wrapped one. A newly created exception is logged using the
     * given logger, or the {@code UserException} logger when none is passed.
     *
     * @param callerLogger logger of the class raising the error, may be null
     * @return user exception
     */
    public UserException build(final Logger callerLogger) {

      if (uex != null) {
        return uex;
      }

      boolean isSystemError = errorType == ErrorType.SYSTEM;

      // make sure system errors use the root error message and display the root cause class name
      if (isSystemError) {
        message = ErrorHelper.getRootMessage(cause);
      }

      final UserException newException = new UserException(this);
      final Logger log = callerLogger == null ? logger : callerLogger;

      // system errors are for the administrator, user mistakes are only worth an INFO line
      if (isSystemError) {
        log.error(newException.getMessage(), newException);
      } else {
        log.info("User Error Occurred: {}", newException.getOriginalMessage(), newException);
      }

      return newException;
    }
  }

  private final ErrorType errorType;

  private final UserExceptionContext context;

  private UserException(final Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.context = builder.context;
  }

  /**
   * generates the message that will be displayed to the client without the stack trace.
   *
   * @return non verbose error message
   */
  @Override
  public String getMessage() {
    return generateMessage(true);
  }

  public String getMessage(boolean includeErrorId) {
    return generateMessage(includeErrorId);
  }

  /**
   * @return the error message that was passed to the builder
   */
  public String getOriginalMessage() {
    return super.getMessage();
  }

  /**
   * generates the message that will be displayed to the client. The message also contains the stack trace.
   *
   * @return verbose error message
   */
  public String getVerboseMessage() {
    return generateMessage(true) + "\n\n" + ErrorHelper.buildCausesMessage(getCause());
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  public String getErrorId() {
    return context.getErrorId();
  }

  /**
   * Generates a user error message that has the following structure:
   * ERROR TYPE ERROR: ERROR_MESSAGE
   * CONTEXT
   * [Error Id: ERROR_ID]
   *
   * @return generated user error message
   */
  private String generateMessage(boolean includeErrorId) {
    return errorType + " ERROR: " + super.getMessage() + "\n\n" +
        context.generateContextMessage(includeErrorId);
  }
}
