package com.brandpulse.api.service;

public class BrandNotFoundException extends RuntimeException {

  private final String brand;

  public BrandNotFoundException(String brand) {
    super("Brand not found: " + brand);
    this.brand = brand;
  }

  public String getBrand() {
    return brand;
  }
}
