package io.intellixity.docsql.examples.service;

import io.intellixity.docsql.exec.TableAdapter;
import io.intellixity.docsql.query.QueryParams;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public final class ProductService {
  private final TableAdapter products;

  public ProductService(TableAdapter products) {
    this.products = products;
  }

  public Map<String, Object> create(Map<String, Object> product) {
    Map<String, Object> p = new LinkedHashMap<>(product);
    p.putIfAbsent("status", "ACTIVE");
    return products.insert(p);
  }

  public List<Object> createAll(List<Map<String, Object>> batch) {
    return products.insertMany(batch);
  }

  public Optional<Map<String, Object>> get(Object id) {
    return products.findById(id);
  }

  public List<Map<String, Object>> search(QueryParams params) {
    return products.find(params == null ? new QueryParams() : params);
  }

  public long count(QueryParams params) {
    return products.count(params == null ? new QueryParams() : params);
  }

  public Optional<Map<String, Object>> adjustStock(Object id, int delta) {
    return products.updateById(id, Map.of("$inc", Map.of("quantity", delta)), true);
  }

  public Optional<Map<String, Object>> replace(Object id, Map<String, Object> product) {
    return products.replaceById(id, product);
  }

  public long discontinue(Map<String, Object> query) {
    return products.updateMany(query, Map.of("status", "DISCONTINUED"), false);
  }

  public Object delete(Object id) {
    return products.removeById(id);
  }
}
