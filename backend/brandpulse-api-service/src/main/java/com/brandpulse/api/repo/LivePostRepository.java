package com.brandpulse.api.repo;

import com.brandpulse.api.entity.LivePost;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LivePostRepository extends JpaRepository<LivePost, String> {
}
