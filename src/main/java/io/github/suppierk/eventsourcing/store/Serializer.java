/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.suppierk.eventsourcing.store;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;

/** Converts event and snapshot payloads to bytes for stores which persist them outside the JVM. */
public interface Serializer {
  /**
   * @return serializer based on {@link java.io.Serializable}, which every message implements
   */
  static Serializer javaSerialization() {
    return JavaSerializer.INSTANCE;
  }

  /**
   * @param value to serialize
   * @return serialized form of the value
   * @throws SerializationException if the value cannot be serialized
   */
  byte[] serialize(final Object value);

  /**
   * @param bytes produced by {@link #serialize(Object)}
   * @param type expected by the caller
   * @param <T> is the payload type
   * @return deserialized value
   * @throws SerializationException if the bytes cannot be read as the given type
   */
  <T> T deserialize(final byte[] bytes, final Class<T> type);

  /** Default implementation using Java object streams */
  final class JavaSerializer implements Serializer {
    private static final Serializer INSTANCE = new JavaSerializer();

    private JavaSerializer() {
      // Cannot be instantiated from the outside
    }

    @Override
    public byte[] serialize(final Object value) {
      if (!(value instanceof Serializable)) {
        throw new SerializationException(
            "%s is not serializable".formatted(value == null ? null : value.getClass().getName()),
            null);
      }

      final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
      try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
        out.writeObject(value);
      } catch (IOException e) {
        throw new SerializationException(
            "Failed to serialize %s".formatted(value.getClass().getName()), e);
      }

      return bytes.toByteArray();
    }

    @Override
    public <T> T deserialize(final byte[] bytes, final Class<T> type) {
      if (bytes == null) {
        throw new IllegalArgumentException("Serialized bytes cannot be null");
      }

      if (type == null) {
        throw new IllegalArgumentException("Payload type cannot be null");
      }

      try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
        return type.cast(in.readObject());
      } catch (IOException | ClassNotFoundException | ClassCastException e) {
        throw new SerializationException(
            "Failed to deserialize %s".formatted(type.getName()), e);
      }
    }
  }
}
