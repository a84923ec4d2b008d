package com.quantori.faves.core.pattern;

import com.quantori.faves.api.query.QueryMolecule;
import lombok.Value;

@Value
public class CompiledPattern {
  String id;
  String name;
  DrugClass drugClass;
  String smarts;
  QueryMolecule query;
}
