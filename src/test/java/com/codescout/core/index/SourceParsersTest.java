package com.codescout.core.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceParsersTest {

    private static List<String> describe(ParsedSource parsed) {
        return parsed.symbols().stream()
                .map(s -> s.kind().wireName() + ":" + (s.parent() != null ? s.parent() + "." : "") + s.name() + "@" + s.line())
                .toList();
    }

    @Nested
    @DisplayName("Java")
    class Java {

        private final JvmSourceParser parser = new JvmSourceParser();

        @Test
        void typesMethodsAndImports() {
            ParsedSource parsed = parser.parse("UserService.java", """
                    package com.acme.service;

                    import com.acme.model.User;
                    import static com.acme.util.Strings.join;

                    public class UserService {
                        private final Repo repo;

                        public UserService(Repo repo) {
                            this.repo = repo;
                        }

                        public User find(String id) {
                            if (id == null) {
                                return null;
                            }
                            return repo.load(id);
                        }

                        record Key(String id) {}

                        interface Listener {
                            void onChange(User user);
                        }
                    }
                    """);

            assertEquals(List.of(
                    "type:UserService@6",
                    "method:UserService.UserService@9",
                    "method:UserService.find@13",
                    "type:UserService.Key@20",
                    "type:UserService.Listener@22",
                    "method:Listener.onChange@23"), describe(parsed));
            assertEquals(List.of("com.acme.model.User", "com.acme.util.Strings.join"), parsed.imports());
        }

        @Test
        @DisplayName("declarations inside strings and comments are ignored")
        void ignoresLiterals() {
            ParsedSource parsed = parser.parse("Text.java", """
                    // class Commented {}
                    class Text {
                        String s = "class Fake { void x() {} }";
                        /* void hidden() { */
                        void visible() {}
                    }
                    """);

            assertEquals(List.of("type:Text@2", "method:Text.visible@5"), describe(parsed));
        }
    }

    @Test
    @DisplayName("Kotlin top-level functions, classes and objects")
    void kotlin() {
        ParsedSource parsed = new JvmSourceParser().parse("Point.kt", """
                import kotlinx.coroutines.launch

                fun topLevel(x: Int): Int = x

                data class Point(val x: Int) {
                    fun norm(): Int = x
                }

                object Registry {
                    fun register() {}
                }
                """);

        assertEquals(List.of(
                "function:topLevel@3",
                "type:Point@5",
                "method:Point.norm@6",
                "type:Registry@9",
                "method:Registry.register@10"), describe(parsed));
        assertEquals(List.of("kotlinx.coroutines.launch"), parsed.imports());
    }

    @Test
    @DisplayName("JavaScript classes, functions, arrow constants and imports")
    void javaScript() {
        ParsedSource parsed = new JavaScriptSourceParser().parse("widget.js", """
                import { helper } from './util';
                import './styles.css';
                const fs = require('fs');

                export class Widget extends Base {
                  constructor(props) {
                    super(props);
                  }

                  render() {
                    if (this.ready) {
                      return helper();
                    }
                  }

                  static async load(id) {
                    return fetch(id);
                  }
                }

                export function build(config) {
                  return new Widget(config);
                }

                export const mount = (el) => {
                  el.append(build({}));
                };
                """);

        assertEquals(List.of(
                "type:Widget@5",
                "method:Widget.render@10",
                "method:Widget.load@16",
                "function:build@21",
                "function:mount@25"), describe(parsed));
        assertEquals(List.of("./util", "./styles.css", "fs"), parsed.imports());
    }

    @Test
    @DisplayName("C# classes, properties and methods inside a namespace")
    void cSharp() {
        ParsedSource parsed = new DotNetSourceParser().parse("Order.cs", """
                using System;
                using System.Collections.Generic;

                namespace Shop
                {
                    public class Order
                    {
                        public int Id { get; set; }

                        public decimal Total()
                        {
                            return 0m;
                        }
                    }
                }
                """);

        assertEquals(List.of(
                "type:Order@6",
                "property:Order.Id@8",
                "method:Order.Total@10"), describe(parsed));
        assertEquals(List.of("System", "System.Collections.Generic"), parsed.imports());
    }

    @Test
    @DisplayName("Go types, receiver methods, functions and import blocks")
    void go() {
        String source = String.join("\n",
                "package store",
                "",
                "import (",
                "\t\"fmt\"",
                "\tlog \"github.com/acme/log\"",
                ")",
                "",
                "type Store struct {",
                "\titems map[string]int",
                "}",
                "",
                "type (",
                "\tKey string",
                "\tValue int",
                ")",
                "",
                "func (s *Store) Get(k Key) Value {",
                "\treturn 0",
                "}",
                "",
                "func New() *Store {",
                "\treturn &Store{}",
                "}");

        ParsedSource parsed = new GoSourceParser().parse("store.go", source);

        assertEquals(List.of(
                "type:Store@8",
                "type:Key@13",
                "type:Value@14",
                "method:Store.Get@17",
                "function:New@21"), describe(parsed));
        assertEquals(List.of("fmt", "github.com/acme/log"), parsed.imports());
    }

    @Test
    @DisplayName("registry picks parsers by extension")
    void registry() {
        SourceParserRegistry registry = new SourceParserRegistry();

        assertInstanceOf(PythonSourceParser.class, registry.parserFor("a/b.py").orElseThrow());
        assertInstanceOf(JavaScriptSourceParser.class, registry.parserFor("web/app.TSX").orElseThrow());
        assertTrue(registry.isSource("Main.kt"));
        assertFalse(registry.isSource("README.md"));
        assertFalse(registry.isSource("Makefile"));
    }
}
