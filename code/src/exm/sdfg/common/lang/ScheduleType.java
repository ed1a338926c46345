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
 * How a scope (map) is executed.  Used to decide where containers can
 * be allocated.
 */
public enum ScheduleType {
  DEFAULT,
  SEQUENTIAL,
  CPU_MULTICORE,
  CPU_PERSISTENT,
  GPU_DEFAULT,
  GPU_DEVICE,
  GPU_THREADBLOCK,
  GPU_PERSISTENT;

  public static ScheduleType fromString(String s) {
    return valueOf(s.trim().toUpperCase());
  }
}
