/** An in-process driver that keeps tables in memory. */
package com.trod.driver.memory;
