/*-
 * #%L
 * This file is part of TEM Nanocrystals.
 * %%
 * Copyright (C) 2024 TEM Nanocrystals developers
 * %%
 * TEM Nanocrystals is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * TEM Nanocrystals is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with TEM Nanocrystals.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package temnano.lib.analysis.images;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestBinaryMask {

	@Test
	public void test_create() {
		boolean[] data = {
				false, true, false,
				true, true, false
		};
		var mask = BinaryMask.create(data, 3, 2);
		data[0] = true;
		assertFalse(mask.get(0, 0));
		assertTrue(mask.get(1, 0));
		assertTrue(mask.get(3));
		assertEquals(3, mask.countTrue());
		assertEquals(1f, mask.getValue(0, 1));
		assertEquals(0f, mask.getValue(2, 1));
		assertEquals(".#.\n##.\n", mask.toPrettyString());
		assertThrows(IndexOutOfBoundsException.class, () -> mask.get(0, 2));
		assertThrows(IndexOutOfBoundsException.class, () -> mask.get(6));
	}

	@Test
	public void test_firstIndexOf() {
		var mask = BinaryMask.create(new boolean[] {true, true, false, true}, 2, 2);
		assertEquals(0, mask.firstIndexOf(true));
		assertEquals(2, mask.firstIndexOf(false));
		var full = BinaryMask.create(new boolean[] {true, true, true, true}, 2, 2);
		assertEquals(-1, full.firstIndexOf(false));
		assertEquals(-1, BinaryMask.empty(2, 2).firstIndexOf(true));
	}

	@Test
	public void test_equality() {
		boolean[] data = {true, false, false, true};
		var mask = BinaryMask.create(data, 2, 2);
		assertEquals(mask, BinaryMask.create(data, 2, 2));
		assertEquals(mask.hashCode(), BinaryMask.create(data, 2, 2).hashCode());
		assertNotEquals(mask, BinaryMask.create(data, 4, 1));
		assertArrayEquals(data, mask.toArray());
	}

}
