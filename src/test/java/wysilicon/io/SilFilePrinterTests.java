// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wysilicon.io;

import static org.junit.jupiter.api.Assertions.*;
import static wysilicon.core.SilFile.*;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import wysilicon.core.SilFile;

public class SilFilePrinterTests {
	private static final Decl.Field F = FIELD("f", Type.Int);
	private static final Decl.Field G = FIELD("g", Type.Int);
	private static final Expr.VariableAccess X = VAR("x", Type.Ref);
	private static final Expr.VariableAccess Y = VAR("y", Type.Ref);

	@Test
	public void test_statements_01() {
		assertEquals("x.f := 5", SilFilePrinter.toString(ASSIGN(FIELDACCESS(X, F), CONST(5))));
		assertEquals("y := new(f, g)", SilFilePrinter.toString(NEW(Y, Arrays.asList(F, G))));
		assertEquals("fold acc(P(x))", SilFilePrinter.toString(FOLD(ACC(PREDICATEACCESS("P", Arrays.asList(X))))));
	}

	@Test
	public void test_expressions_01() {
		Expr.FieldAccess xf = FIELDACCESS(X, F);
		assertEquals("acc(x.f)", SilFilePrinter.toString(ACC(xf)));
		assertEquals("acc(x.f, 1 / 2)", SilFilePrinter.toString(ACC(xf, FRACTION(CONST(1), CONST(2)))));
		assertEquals("acc(x.f) && (x.f == 5)", SilFilePrinter.toString(AND(ACC(xf), EQ(xf, CONST(5)))));
		assertEquals("acc(x.g) --* acc(x.f)", SilFilePrinter.toString(WAND(ACC(FIELDACCESS(X, G)), ACC(xf))));
		assertEquals("!(x == null)", SilFilePrinter.toString(NOT(EQ(X, NULL()))));
	}

	@Test
	public void test_file_01() {
		SilFile file = new SilFile();
		file.add(F);
		file.add(METHOD("test", Arrays.asList(PARAMETER("x", Type.Ref)), Collections.emptyList(),
				Arrays.asList(ACC(FIELDACCESS(X, F))), Collections.emptyList(), ASSIGN(FIELDACCESS(X, F), CONST(5))));
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		SilFilePrinter printer = new SilFilePrinter(bout);
		printer.write(file);
		String[] lines = new String(bout.toByteArray(), StandardCharsets.UTF_8).split("\\R");
		assertArrayEquals(new String[] { "field f: Int", "method test(x: Ref)", "  requires acc(x.f)", "{",
				"  x.f := 5", "}" }, lines);
	}
}
