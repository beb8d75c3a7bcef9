// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import java.util.logging.Logger;

/// We are using JUL logging to reduce dependencies. You can configure JUL logging to bridge to your chosen logging
/// framework. Every class in the library logs through this one logger so that a host application can set a single
/// level for the mesh.
public final class MeshLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.field_mesh");

  private MeshLogger() {
  }
}
