package exm.optree.tree;

import exm.optree.common.lang.Symbols.EventSymbol;
import exm.optree.common.lang.Symbols.FieldSymbol;
import exm.optree.common.lang.Symbols.LabelSymbol;
import exm.optree.common.lang.Symbols.LocalSymbol;
import exm.optree.common.lang.Symbols.MethodSymbol;
import exm.optree.common.lang.Symbols.ParameterSymbol;
import exm.optree.common.lang.Symbols.PropertySymbol;
import exm.optree.common.lang.Symbols.SymbolKind;
import exm.optree.common.lang.Symbols.TypeSymbol;

/**
 * Symbol standing in for whatever the binder would resolve
 */
public class FakeSymbol implements TypeSymbol, LocalSymbol, ParameterSymbol,
        FieldSymbol, PropertySymbol, EventSymbol, MethodSymbol, LabelSymbol {
  private final String name;
  private final SymbolKind symbolKind;

  public FakeSymbol(String name, SymbolKind symbolKind) {
    this.name = name;
    this.symbolKind = symbolKind;
  }

  public static FakeSymbol type(String name) {
    return new FakeSymbol(name, SymbolKind.TYPE);
  }

  public static FakeSymbol local(String name) {
    return new FakeSymbol(name, SymbolKind.LOCAL);
  }

  public static FakeSymbol method(String name) {
    return new FakeSymbol(name, SymbolKind.METHOD);
  }

  public static FakeSymbol label(String name) {
    return new FakeSymbol(name, SymbolKind.LABEL);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public SymbolKind symbolKind() {
    return symbolKind;
  }

  @Override
  public boolean isStatic() {
    return false;
  }

  @Override
  public int ordinal() {
    return 0;
  }

  @Override
  public String toString() {
    return symbolKind + " " + name;
  }
}
