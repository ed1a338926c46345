/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.sdfg.common.lang;

/**
 * Where a data container lives.
 */
public enum StorageType {
  DEFAULT,
  REGISTER,
  CPU_HEAP,
  CPU_PINNED,
  CPU_THREADLOCAL,
  GPU_GLOBAL,
  GPU_SHARED;

  /**
   * Whether a container with this storage can be allocated inside a scope
   * with the given schedule.
   */
  public boolean canAllocateIn(ScheduleType schedule) {
    switch (this) {
      case CPU_HEAP:
      case CPU_PINNED:
      case CPU_THREADLOCAL:
      case GPU_GLOBAL:
        // Host-side allocation only
        return schedule == ScheduleType.CPU_MULTICORE ||
               schedule == ScheduleType.CPU_PERSISTENT ||
               schedule == ScheduleType.SEQUENTIAL ||
               schedule == ScheduleType.GPU_DEFAULT;
      case GPU_SHARED:
        return schedule == ScheduleType.GPU_DEVICE ||
               schedule == ScheduleType.GPU_THREADBLOCK ||
               schedule == ScheduleType.GPU_PERSISTENT ||
               schedule == ScheduleType.GPU_DEFAULT;
      default:
        // Registers and default storage go anywhere
        return true;
    }
  }

  public static StorageType fromString(String s) {
    return valueOf(s.trim().toUpperCase());
  }
}
