package io.intellixity.docsql.examples.web;

import io.intellixity.docsql.examples.service.ProductService;
import io.intellixity.docsql.query.QueryParams;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/products")
public final class ProductController {
  private final ProductService products;

  public ProductController(ProductService products) {
    this.products = products;
  }

  public record StockChange(int delta) {}

  @PostMapping
  public Map<String, Object> create(@RequestBody Map<String, Object> product) {
    return products.create(product);
  }

  @PostMapping("/batch")
  public List<Object> createAll(@RequestBody List<Map<String, Object>> batch) {
    return products.createAll(batch);
  }

  @GetMapping("/{id}")
  public ResponseEntity<Map<String, Object>> get(@PathVariable("id") long id) {
    return products.get(id).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
  }

  /** Body: {"query": {...}, "search": "...", "searchFields": [...], "sort": [...], "limit": n, "offset": n}. */
  @PostMapping(value = "/search", consumes = MediaType.APPLICATION_JSON_VALUE)
  public List<Map<String, Object>> search(@RequestBody QueryParams params) {
    return products.search(params);
  }

  @PostMapping("/count")
  public long count(@RequestBody(required = false) QueryParams params) {
    return products.count(params);
  }

  @PostMapping("/{id}/stock")
  public ResponseEntity<Map<String, Object>> adjustStock(@PathVariable("id") long id, @RequestBody StockChange change) {
    return products.adjustStock(id, change.delta()).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PutMapping("/{id}")
  public ResponseEntity<Map<String, Object>> replace(@PathVariable("id") long id, @RequestBody Map<String, Object> product) {
    return products.replace(id, product).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PostMapping("/discontinue")
  public long discontinue(@RequestBody Map<String, Object> query) {
    return products.discontinue(query);
  }

  @DeleteMapping("/{id}")
  public Object delete(@PathVariable("id") long id) {
    return products.delete(id);
  }
}
